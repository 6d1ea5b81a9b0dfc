package lab.fieldservice.orchestration;

import jakarta.servlet.http.HttpServletRequest;
import lab.fieldservice.adapter.EntityGateway;
import lab.fieldservice.adapter.EntityGateway.PageResult;
import lab.fieldservice.adapter.ListQuery;
import lab.fieldservice.common.ErrorResponse;
import lab.fieldservice.common.InvalidRequestException;
import lab.fieldservice.config.RlsProperties;
import lab.fieldservice.domain.RowScoped;
import lab.fieldservice.orchestration.policy.Requester;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * CRUD endpoints shared by every secured resource. Subclasses only translate request bodies
 * into entities; all access decisions go through {@link RowLevelSecurityMediator}.
 *
 * @param <T> entity type
 * @param <R> request body type used for both create and update
 */
@Slf4j
public abstract class SecuredEntityController<T extends RowScoped, R> {

    private final RowLevelSecurityMediator mediator;
    private final EntityGateway<T> gateway;
    private final RequesterResolver requesterResolver;
    private final RlsProperties.PaginationProperties pagination;

    protected SecuredEntityController(
            RowLevelSecurityMediator mediator,
            EntityGateway<T> gateway,
            RequesterResolver requesterResolver,
            RlsProperties rlsProperties
    ) {
        this.mediator = mediator;
        this.gateway = gateway;
        this.requesterResolver = requesterResolver;
        this.pagination = rlsProperties.pagination();
    }

    /**
     * Builds a new, unsaved entity. Throws {@link InvalidRequestException} when a required field is missing.
     */
    protected abstract T toEntity(R request);

    /**
     * Copies the non-null fields of {@code request} onto {@code entity}.
     */
    protected abstract void applyChanges(T entity, R request);

    /**
     * Human-readable singular name used in response messages, e.g. "Invoice".
     */
    protected abstract String displayName();

    @GetMapping
    public ResponseEntity<?> list(@RequestParam Map<String, String> params, HttpServletRequest request) {
        Requester requester = requesterResolver.resolve(request);
        ListQuery query = ListQuery.from(params, gateway.metadata(), pagination.defaultLimit(), pagination.maxLimit());
        log.info(
                "event=resource.list.request resource={} page={} limit={} search={} filters={}",
                gateway.getResourceType().id(),
                query.page(),
                query.limit(),
                query.search(),
                query.filters().keySet()
        );

        AccessResult<PageResult<T>> result = mediator.list(requester, gateway, query);
        return respond(result, HttpStatus.OK, () -> ListResponse.of(result.body(), result.rlsApplied()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable Long id, HttpServletRequest request) {
        Requester requester = requesterResolver.resolve(request);
        AccessResult<T> result = mediator.get(requester, gateway, id);
        return respond(result, HttpStatus.OK, () -> RecordResponse.of(result.body(), result.rlsApplied()));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody R body, HttpServletRequest request) {
        Requester requester = requesterResolver.resolve(request);
        if (body == null) {
            throw new InvalidRequestException("Request body is required");
        }
        AccessResult<T> result = mediator.create(requester, gateway, toEntity(body));
        return respond(result, HttpStatus.CREATED,
                () -> WriteResponse.of(displayName() + " created successfully", result.body()));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id, @RequestBody R body, HttpServletRequest request) {
        Requester requester = requesterResolver.resolve(request);
        if (body == null) {
            throw new InvalidRequestException("Request body is required");
        }
        AccessResult<T> result = mediator.update(requester, gateway, id, entity -> applyChanges(entity, body));
        return respond(result, HttpStatus.OK,
                () -> WriteResponse.of(displayName() + " updated successfully", result.body()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable Long id, HttpServletRequest request) {
        Requester requester = requesterResolver.resolve(request);
        AccessResult<T> result = mediator.delete(requester, gateway, id);
        return respond(result, HttpStatus.OK, () -> WriteResponse.of(displayName() + " deleted successfully"));
    }

    protected static <V> V required(V value, String field) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            throw new InvalidRequestException(field + " is required");
        }
        return value;
    }

    private ResponseEntity<?> respond(AccessResult<?> result, HttpStatus okStatus, Supplier<Object> okBody) {
        return switch (result.status()) {
            case OK -> ResponseEntity.status(okStatus).body(okBody.get());
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(
                    HttpStatus.NOT_FOUND.value(), "Not Found", displayName() + " not found"));
            case FORBIDDEN -> ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorResponse.of(
                    HttpStatus.FORBIDDEN.value(), "Forbidden",
                    "Insufficient permissions for this " + displayName().toLowerCase(Locale.ROOT) + " operation"));
        };
    }
}
