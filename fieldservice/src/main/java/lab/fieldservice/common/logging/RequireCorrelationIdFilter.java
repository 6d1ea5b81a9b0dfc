package lab.fieldservice.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

/**
 * Passes only events logged inside a request, i.e. carrying a correlation id in the MDC.
 * Events logged for requests without a known requester can optionally be dropped as well.
 */
public class RequireCorrelationIdFilter extends Filter<ILoggingEvent> {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String USER_ID_KEY = "userId";

    private boolean requireUser;

    public void setRequireUser(boolean requireUser) {
        this.requireUser = requireUser;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc == null || !mdc.containsKey(CORRELATION_ID_KEY)) {
            return FilterReply.DENY;
        }
        if (requireUser && "-".equals(mdc.getOrDefault(USER_ID_KEY, "-"))) {
            return FilterReply.DENY;
        }
        return FilterReply.NEUTRAL;
    }
}
