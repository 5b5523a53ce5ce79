package com.anthem.pubsub.gateway.subscription;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryFilterTest {

    private Map<String, Object> authInfo;
    private DeliveryFilter filter;

    @BeforeEach
    void setUp() {
        authInfo = new HashMap<>();
        authInfo.put("tenant", "A");
        filter = new DeliveryFilter("chat.room1", List.of("tenant"), () -> authInfo);
    }

    // ===== Field filter =====

    @Test
    void testFieldFilter_matchingValueDelivered() {
        assertThat(filter.shouldDeliverMessage(Map.of("tenant", "A", "x", 1))).isTrue();
    }

    @Test
    void testFieldFilter_mismatchingValueDropped() {
        assertThat(filter.shouldDeliverMessage(Map.of("tenant", "B", "x", 1))).isFalse();
    }

    @Test
    void testFieldFilter_absentFieldNotChecked() {
        assertThat(filter.shouldDeliverMessage(Map.of("x", 1))).isTrue();
    }

    @Test
    void testFieldFilter_fieldMissingFromAuthInfoDropped() {
        authInfo.clear();

        assertThat(filter.shouldDeliverMessage(Map.of("tenant", "A"))).isFalse();
    }

    @Test
    void testFieldFilter_numericValuesCompareByValue() {
        authInfo.put("tenant", 7);

        assertThat(filter.shouldDeliverMessage(Map.of("tenant", 7L))).isTrue();
        assertThat(filter.shouldDeliverMessage(Map.of("tenant", 8L))).isFalse();
    }

    // ===== Order filter =====

    @Test
    void testOrder_lowerOrderAfterHigherDropped() {
        assertThat(filter.shouldDeliverMessage(order("k", 5))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("k", 3))).isFalse();
        assertThat(filter.getLastOrder("k")).contains(BigInteger.valueOf(5));
    }

    @Test
    void testOrder_higherOrderDeliveredAndRecorded() {
        assertThat(filter.shouldDeliverMessage(order("k", 5))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("k", 7))).isTrue();
        assertThat(filter.getLastOrder("k")).contains(BigInteger.valueOf(7));
    }

    @Test
    void testOrder_equalOrderDropped() {
        assertThat(filter.shouldDeliverMessage(order("k", 5))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("k", 5))).isFalse();
    }

    @Test
    void testOrder_unparsableOrderAlwaysDropped() {
        Map<String, Object> message = new HashMap<>();
        message.put("_order", "abc");

        assertThat(filter.shouldDeliverMessage(message)).isFalse();
        assertThat(filter.getLastOrder(null)).isEmpty();

        filter.shouldDeliverMessage(order(null, 1));
        assertThat(filter.shouldDeliverMessage(message)).isFalse();
    }

    @Test
    void testOrder_nullOrderDropped() {
        Map<String, Object> message = new HashMap<>();
        message.put("_order", null);

        assertThat(filter.shouldDeliverMessage(message)).isFalse();
    }

    @Test
    void testOrder_numericStringAccepted() {
        Map<String, Object> message = new HashMap<>();
        message.put("_order", "12");

        assertThat(filter.shouldDeliverMessage(message)).isTrue();
        assertThat(filter.getLastOrder(null)).contains(BigInteger.valueOf(12));
    }

    @Test
    void testOrder_messagesWithoutOrderAlwaysPass() {
        filter.shouldDeliverMessage(order(null, 100));

        assertThat(filter.shouldDeliverMessage(Map.of("data", "x"))).isTrue();
        assertThat(filter.shouldDeliverMessage(Map.of("data", "y"))).isTrue();
    }

    @Test
    void testOrder_keysAreIndependent() {
        assertThat(filter.shouldDeliverMessage(order("a", 10))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("b", 1))).isTrue();
        assertThat(filter.shouldDeliverMessage(order(null, 2))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("a", 3))).isFalse();

        assertThat(filter.getLastOrder("a")).contains(BigInteger.valueOf(10));
        assertThat(filter.getLastOrder("b")).contains(BigInteger.valueOf(1));
        assertThat(filter.getLastOrder(null)).contains(BigInteger.valueOf(2));
    }

    @Test
    void testOrder_orderBeyondLongRangeKeepsOrdering() {
        BigInteger big = BigInteger.ONE.shiftLeft(63);

        assertThat(filter.shouldDeliverMessage(order("k", big))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("k", 1))).isFalse();
        assertThat(filter.shouldDeliverMessage(order("k", Long.MAX_VALUE))).isFalse();
        assertThat(filter.getLastOrder("k")).contains(big);

        assertThat(filter.shouldDeliverMessage(order("k", big.add(BigInteger.ONE)))).isTrue();
    }

    @Test
    void testOrder_largeNumericStringAccepted() {
        assertThat(filter.shouldDeliverMessage(order("k", "18446744073709551616"))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("k", "18446744073709551615"))).isFalse();
        assertThat(filter.getLastOrder("k")).contains(new BigInteger("18446744073709551616"));
    }

    @Test
    void testOrder_largeDoubleNotClamped() {
        assertThat(filter.shouldDeliverMessage(order("k", 1e20))).isTrue();
        assertThat(filter.shouldDeliverMessage(order("k", Long.MAX_VALUE))).isFalse();
        assertThat(filter.getLastOrder("k")).contains(new BigDecimal(1e20).toBigInteger());
    }

    @Test
    void testOrder_nonFiniteDoubleDropped() {
        assertThat(filter.shouldDeliverMessage(order("k", Double.NaN))).isFalse();
        assertThat(filter.shouldDeliverMessage(order("k", Float.POSITIVE_INFINITY))).isFalse();
        assertThat(filter.getLastOrder("k")).isEmpty();
    }

    @Test
    void testOrder_fractionTruncated() {
        assertThat(filter.shouldDeliverMessage(order("k", 2.7))).isTrue();
        assertThat(filter.getLastOrder("k")).contains(BigInteger.TWO);
    }

    @Test
    void testFieldRejectionDoesNotRecordOrder() {
        Map<String, Object> rejected = order("k", 5);
        rejected.put("tenant", "B");

        assertThat(filter.shouldDeliverMessage(rejected)).isFalse();
        assertThat(filter.getLastOrder("k")).isEmpty();
        assertThat(filter.shouldDeliverMessage(order("k", 3))).isTrue();
    }

    private Map<String, Object> order(Object key, Object order) {
        Map<String, Object> message = new HashMap<>();
        message.put("_order", order);
        if (key != null) {
            message.put("_order_key", key);
        }
        return message;
    }
}
