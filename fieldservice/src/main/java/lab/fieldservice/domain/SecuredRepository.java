package lab.fieldservice.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

@NoRepositoryBean
public interface SecuredRepository<T extends RowScoped> extends JpaRepository<T, Long>, JpaSpecificationExecutor<T> {
}
