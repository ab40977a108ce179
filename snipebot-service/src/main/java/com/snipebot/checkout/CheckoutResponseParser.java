package com.snipebot.checkout;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Field extraction for checkout responses, which come in several shapes depending on the marketplace version.
 */
public final class CheckoutResponseParser {

    private CheckoutResponseParser() {
    }

    public static Optional<String> purchaseId(JsonNode data) {
        return firstText(data.get("id"), data.get("purchase_id"), data.path("purchase").get("id"));
    }

    public static Optional<Long> shippingOrderId(JsonNode data) {
        JsonNode orders = data.path("purchase").get("shipping_orders");
        if (orders == null || orders.isNull()) {
            orders = data.get("shipping_orders");
        }
        if (orders == null || orders.isNull()) {
            orders = data.get("shipping_orders_list");
        }
        if (orders != null && orders.isArray() && !orders.isEmpty()) {
            JsonNode first = orders.get(0);
            JsonNode id = first.hasNonNull("id") ? first.get("id") : first.get("shipping_order_id");
            Optional<Long> parsed = asLong(id);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        JsonNode direct = data.get("shipping_order_id");
        return direct != null && direct.isIntegralNumber() ? Optional.of(direct.asLong()) : Optional.empty();
    }

    public static Optional<PaymentMethod> paymentMethod(JsonNode data) {
        JsonNode methods = data.get("payment_methods");
        if (methods == null || methods.isNull()) {
            methods = data.get("pay_in_methods");
        }
        if (methods == null || methods.isNull()) {
            methods = data.path("purchase").get("payment_methods");
        }
        if (methods != null && methods.isArray() && !methods.isEmpty()) {
            JsonNode first = methods.get(0);
            Optional<String> cardId = firstText(first.get("id"), first.get("card_id"));
            if (cardId.isPresent()) {
                String payIn = firstText(first.get("pay_in_method_id"), first.get("id")).orElse("1");
                return Optional.of(new PaymentMethod(cardId.get(), payIn));
            }
        }

        JsonNode purchase = data.path("purchase");
        JsonNode saved = purchase.hasNonNull("payment_method")
                ? purchase.get("payment_method")
                : purchase.get("default_payment_method");
        if (saved != null && saved.isObject()) {
            return firstText(saved.get("card_id"), saved.get("id")).map(id -> new PaymentMethod(id, "1"));
        }
        return Optional.empty();
    }

    /**
     * Pickup point candidates. Entries without a rate uuid or point code are dropped.
     */
    public static List<PickupPoint> pickupPoints(JsonNode data) {
        List<PickupPoint> out = new ArrayList<>();
        JsonNode flat = firstArray(data, "pickup_points", "points", "nearby_pickup_points");
        if (flat != null) {
            for (JsonNode p : flat) {
                addPoint(out, p, null);
            }
            return out;
        }

        JsonNode rates = data.get("rates");
        if (rates != null && rates.isArray()) {
            for (JsonNode rate : rates) {
                JsonNode pts = firstArray(rate, "pickup_points", "points");
                if (pts == null) {
                    continue;
                }
                String rateUuid = firstText(rate.get("uuid"), rate.get("id")).orElse(null);
                for (JsonNode p : pts) {
                    addPoint(out, p, rateUuid);
                }
            }
        }
        return out;
    }

    public static Optional<String> approvalUrl(JsonNode data) {
        return firstText(data.get("redirect_url"), data.get("three_ds_url"), data.get("url"))
                .filter(s -> !s.isBlank());
    }

    private static void addPoint(List<PickupPoint> out, JsonNode p, String inheritedRateUuid) {
        String rateUuid = inheritedRateUuid != null
                ? inheritedRateUuid
                : firstText(p.get("rate_uuid"), p.path("rate").get("uuid")).orElse(null);
        String pointCode = firstText(p.get("point_code"), p.get("code"), p.get("id")).orElse(null);
        String pointUuid = firstText(p.get("point_uuid"), p.get("uuid"), p.get("id")).orElse("");
        if (rateUuid == null || rateUuid.isEmpty() || pointCode == null || pointCode.isEmpty()) {
            return;
        }
        out.add(new PickupPoint(rateUuid, pointCode, pointUuid, coordinate(p.get("latitude")),
                coordinate(p.get("longitude"))));
    }

    private static double coordinate(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static JsonNode firstArray(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode v = node.get(field);
            if (v != null && v.isArray()) {
                return v;
            }
        }
        return null;
    }

    private static Optional<String> firstText(JsonNode... candidates) {
        for (JsonNode c : candidates) {
            if (c != null && !c.isNull() && c.isValueNode()) {
                String s = c.asText();
                if (!s.isEmpty()) {
                    return Optional.of(s);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Long> asLong(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return Optional.of(node.asLong());
        }
        try {
            return Optional.of(Long.parseLong(node.asText().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
