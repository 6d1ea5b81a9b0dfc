package lab.fieldservice.config;

import lab.fieldservice.orchestration.policy.PolicyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RlsConfig {

    // Built once at startup; a broken policy table aborts the context instead of failing per request.
    @Bean
    public PolicyRegistry policyRegistry(RlsProperties properties) {
        return new PolicyRegistry(properties.toPolicies());
    }
}
