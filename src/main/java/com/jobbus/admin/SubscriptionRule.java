package com.jobbus.admin;

/**
 * Routing rule of a subscription.
 * <p>
 * A message addressed to the subscription by name ({@code to}) is always accepted. When
 * {@code acceptBroadcast} is set, messages without an address are accepted too.
 */
public record SubscriptionRule(String name, boolean acceptBroadcast) {

    public static final String DEFAULT_RULE_NAME = "$Default";

    public SubscriptionRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name must not be blank");
        }
    }

    public static SubscriptionRule broadcastOrAddressed() {
        return new SubscriptionRule(DEFAULT_RULE_NAME, true);
    }

    public static SubscriptionRule addressedOnly() {
        return new SubscriptionRule(DEFAULT_RULE_NAME, false);
    }

    public boolean accepts(String to, String subscriptionName) {
        if (to == null) {
            return acceptBroadcast;
        }
        return to.equals(subscriptionName);
    }

    /**
     * Renders the rule as a SQL filter over the broker's {@code To} system property.
     */
    public String filterExpression(String subscriptionName) {
        String addressed = "sys.To = '" + subscriptionName.replace("'", "''") + "'";
        return acceptBroadcast ? "sys.To IS NULL OR " + addressed : addressed;
    }
}
