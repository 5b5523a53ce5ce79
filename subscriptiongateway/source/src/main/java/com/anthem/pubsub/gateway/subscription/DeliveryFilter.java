package com.anthem.pubsub.gateway.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decides whether a message may be delivered to the subscribed session.
 * 
 * Two checks run in order:
 * <ol>
 *   <li>field filter: every configured filter field present in the message
 *       must equal the session's auth info value for that field;</li>
 *   <li>order filter: a message carrying {@code _order} must have an
 *       integer order strictly greater than the last accepted order for its
 *       {@code _order_key}. Messages without {@code _order} always pass.</li>
 * </ol>
 * A rejected message is dropped; it is never an error.
 */
public class DeliveryFilter {

    private static final Logger log = LoggerFactory.getLogger(DeliveryFilter.class);

    public static final String ORDER_FIELD = "_order";
    public static final String ORDER_KEY_FIELD = "_order_key";

    private final String subscriptionName;
    private final List<String> filterFields;
    private final Supplier<Map<String, Object>> authInfo;

    // order key -> last accepted order; the null key is the default bucket
    private final Map<Object, BigInteger> orderState = new HashMap<>();

    public DeliveryFilter(String subscriptionName, List<String> filterFields,
                          Supplier<Map<String, Object>> authInfo) {
        this.subscriptionName = subscriptionName;
        this.filterFields = List.copyOf(filterFields);
        this.authInfo = authInfo;
    }

    public synchronized boolean shouldDeliverMessage(Map<String, ?> data) {
        if (!matchesFilterFields(data)) {
            log.debug("Message filtered: subscription={}, reason=fields, data={}", subscriptionName, data);
            return false;
        }

        if (!isInOrder(data)) {
            log.debug("Message filtered: subscription={}, reason=order, data={}", subscriptionName, data);
            return false;
        }

        return true;
    }

    /**
     * Last accepted order for the given key, if any.
     */
    public synchronized Optional<BigInteger> getLastOrder(Object orderKey) {
        return Optional.ofNullable(orderState.get(orderKey));
    }

    private boolean matchesFilterFields(Map<String, ?> data) {
        Map<String, Object> auth = authInfo.get();
        for (String field : filterFields) {
            if (data.containsKey(field) && !valuesMatch(auth.get(field), data.get(field))) {
                return false;
            }
        }
        return true;
    }

    private boolean isInOrder(Map<String, ?> data) {
        if (!data.containsKey(ORDER_FIELD)) {
            return true;
        }

        Optional<BigInteger> order = parseOrder(data.get(ORDER_FIELD));
        if (order.isEmpty()) {
            return false;
        }

        Object key = data.get(ORDER_KEY_FIELD);
        BigInteger lastOrder = orderState.get(key);
        if (lastOrder != null && order.get().compareTo(lastOrder) <= 0) {
            return false;
        }

        orderState.put(key, order.get());
        return true;
    }

    static Optional<BigInteger> parseOrder(Object value) {
        if (value instanceof BigInteger big) {
            return Optional.of(big);
        }
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal.toBigInteger());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(d).toBigInteger());
        }
        if (value instanceof Number number) {
            return Optional.of(BigInteger.valueOf(number.longValue()));
        }
        if (value instanceof String text) {
            try {
                return Optional.of(new BigInteger(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    // JSON numbers may decode to different boxed types on each side
    private static boolean valuesMatch(Object expected, Object actual) {
        if (expected instanceof Number a && actual instanceof Number b) {
            try {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
            } catch (NumberFormatException e) {
                return a.equals(b);
            }
        }
        return Objects.equals(expected, actual);
    }
}
