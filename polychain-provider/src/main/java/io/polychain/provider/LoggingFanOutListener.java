package io.polychain.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingFanOutListener implements FanOutListener {

    private static final Logger LOG = LoggerFactory.getLogger(BatchFanOut.class);

    static final LoggingFanOutListener INSTANCE = new LoggingFanOutListener();

    private LoggingFanOutListener() {
    }

    @Override
    public void onItemFailure(final String handlerName, final Object input, final Throwable cause) {
        LOG.debug("Error in calling {}. input: {}, reason: {}", handlerName, input, cause.toString(), cause);
    }
}
