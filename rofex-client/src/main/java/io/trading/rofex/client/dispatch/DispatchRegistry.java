package io.trading.rofex.client.dispatch;

import io.trading.rofex.client.error.HandlerException;
import io.trading.rofex.protocol.error.RofexException;
import io.trading.rofex.protocol.message.ErrorMessage;
import io.trading.rofex.protocol.message.InboundMessage;
import io.trading.rofex.protocol.message.MarketDataMessage;
import io.trading.rofex.protocol.message.MessageCategory;
import io.trading.rofex.protocol.message.OrderReportMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers per message category, invoked in registration order.
 *
 * Registration and removal may happen from any thread, including from inside a handler;
 * a dispatch in progress sees the handler list as it was when the dispatch started.
 * A handler that throws does not prevent later handlers from running: the failure is
 * wrapped in {@link HandlerException} and given to the exception handler.
 */
public class DispatchRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchRegistry.class);

    private final Map<MessageCategory, List<Registration>> handlers = new EnumMap<>(MessageCategory.class);
    private volatile ExceptionHandler exceptionHandler;

    public DispatchRegistry() {
        for (MessageCategory category : MessageCategory.values()) {
            handlers.put(category, new CopyOnWriteArrayList<>());
        }
    }

    public void addMarketDataHandler(MessageHandler<MarketDataMessage> handler) {
        register(MessageCategory.MARKET_DATA, handler, MarketDataMessage.class);
    }

    public void addOrderReportHandler(MessageHandler<OrderReportMessage> handler) {
        register(MessageCategory.ORDER_REPORT, handler, OrderReportMessage.class);
    }

    public void addErrorHandler(MessageHandler<ErrorMessage> handler) {
        register(MessageCategory.ERROR, handler, ErrorMessage.class);
    }

    public boolean removeMarketDataHandler(MessageHandler<MarketDataMessage> handler) {
        return remove(MessageCategory.MARKET_DATA, handler);
    }

    public boolean removeOrderReportHandler(MessageHandler<OrderReportMessage> handler) {
        return remove(MessageCategory.ORDER_REPORT, handler);
    }

    public boolean removeErrorHandler(MessageHandler<ErrorMessage> handler) {
        return remove(MessageCategory.ERROR, handler);
    }

    /**
     * Sets the exception handler, replacing any previous one. Null clears it.
     */
    public void setExceptionHandler(ExceptionHandler exceptionHandler) {
        this.exceptionHandler = exceptionHandler;
    }

    public ExceptionHandler getExceptionHandler() {
        return exceptionHandler;
    }

    public int handlerCount(MessageCategory category) {
        return handlers.get(category).size();
    }

    /**
     * Registers a handler for a category. Registering the same handler twice invokes it twice.
     */
    public <M extends InboundMessage> void register(MessageCategory category, MessageHandler<M> handler, Class<M> type) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        handlers.get(category).add(new Registration(handler, message -> handler.onMessage(type.cast(message))));
    }

    /**
     * Removes the first registration of the handler. Unknown handlers are ignored.
     *
     * @return true if a registration was removed
     */
    public boolean remove(MessageCategory category, MessageHandler<?> handler) {
        List<Registration> registrations = handlers.get(category);
        for (Registration registration : registrations) {
            if (registration.handler() == handler) {
                return registrations.remove(registration);
            }
        }
        return false;
    }

    /**
     * Invokes every handler registered for the message's category.
     * Anything a handler throws, errors included, is reported and the next handler runs;
     * only a {@link VirtualMachineError} propagates.
     *
     * @return Number of handlers that threw
     */
    public int dispatch(InboundMessage message) {
        int failures = 0;
        for (Registration registration : handlers.get(message.category())) {
            try {
                registration.invoker().onMessage(message);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                failures++;
                reportError(new HandlerException(message.category(), message, e));
            }
        }
        return failures;
    }

    /**
     * Gives a fault to the exception handler, or logs it when none is set.
     */
    public void reportError(RofexException exception) {
        ExceptionHandler current = exceptionHandler;
        if (current == null) {
            LOGGER.error("Unhandled session error: {}", exception.getMessage(), exception);
            return;
        }
        try {
            current.onException(exception);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            LOGGER.error("Exception handler failed while handling: {}", exception.getMessage(), e);
        }
    }

    private record Registration(MessageHandler<?> handler, MessageHandler<InboundMessage> invoker) {
    }
}
