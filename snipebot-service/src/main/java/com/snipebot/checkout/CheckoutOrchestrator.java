package com.snipebot.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.snipebot.bridge.BridgeErrorCode;
import com.snipebot.bridge.BridgeResult;
import com.snipebot.bridge.CheckoutClient;
import com.snipebot.bridge.RateLimitRetrier;
import com.snipebot.config.SnipebotProperties;
import com.snipebot.events.PipelineEvent;
import com.snipebot.events.PipelineEventPublisher;
import com.snipebot.ledger.PurchaseLedger;
import com.snipebot.model.FeedItem;
import com.snipebot.proxy.ProxyPoolManager;
import com.snipebot.proxy.ProxyUrls;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Runs the multi-step purchase for one item through a single sticky proxy.
 *
 * Every bridge call is retried on rate limiting only. A failing step ends the checkout with the upstream code
 * and message; nothing is thrown to the caller. There is no overall timeout: a checkout lasts as long as its
 * bridge calls do.
 */
@Slf4j
public class CheckoutOrchestrator {

    private final CheckoutClient client;
    private final RateLimitRetrier retrier;
    private final ProxyPoolManager proxies;
    private final PurchaseLedger ledger;
    private final ApprovalOpener approvalOpener;
    private final PipelineEventPublisher events;
    private final SnipebotProperties.Checkout config;
    private final ObjectMapper objectMapper;

    private final Counter completedCounter;
    private final Counter awaitingApprovalCounter;
    private final Counter failedCounter;

    public CheckoutOrchestrator(
            CheckoutClient client,
            RateLimitRetrier retrier,
            ProxyPoolManager proxies,
            PurchaseLedger ledger,
            ApprovalOpener approvalOpener,
            PipelineEventPublisher events,
            SnipebotProperties.Checkout config,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this.client = client;
        this.retrier = retrier;
        this.proxies = proxies;
        this.ledger = ledger;
        this.approvalOpener = approvalOpener;
        this.events = events;
        this.config = config;
        this.objectMapper = objectMapper;

        this.completedCounter = Counter.builder("checkout.completed")
                .description("Checkouts that finished without external approval")
                .register(meterRegistry);
        this.awaitingApprovalCounter = Counter.builder("checkout.awaiting_approval")
                .description("Checkouts handed to the buyer for payment approval")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("checkout.failed")
                .description("Checkouts that ended in a failure")
                .register(meterRegistry);
    }

    /**
     * @param proxy  sticky proxy for every request of this checkout, or {@code null} for direct requests
     * @param ruleId rule the purchase is charged to, or {@code null}
     */
    public CompletableFuture<CheckoutResult> runCheckout(FeedItem item, String proxy, Long ruleId) {
        Session session = new Session(item, proxy, ruleId);
        log.info("checkout start itemId={} orderId={} price={} proxy={}",
                item.id(), item.checkoutOrderId(), item.price(), ProxyUrls.mask(proxy));
        session.advance(CheckoutStep.BUILD_REQUESTED);

        return call(session, "checkout.build", () -> client.buildCheckout(item.checkoutOrderId(), proxy))
                .thenCompose(build -> afterBuild(session, build))
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.error("checkout crashed itemId={}", item.id(), cause);
                    return CheckoutResult.failed(BridgeErrorCode.REQUEST_FAILED.name(),
                            "Checkout failed: " + cause.getMessage(), session.purchaseId);
                })
                .thenApply(result -> finish(session, result));
    }

    private CompletableFuture<CheckoutResult> afterBuild(Session session, BridgeResult build) {
        if (!build.ok()) {
            return done(CheckoutResult.failed(build.code(), build.describe()));
        }
        Optional<String> purchaseId = CheckoutResponseParser.purchaseId(build.data());
        if (purchaseId.isEmpty()) {
            return done(CheckoutResult.failed(null, CheckoutResult.NO_PURCHASE_ID));
        }
        session.purchaseId = purchaseId.get();
        session.buildData = build.data();
        session.advance(CheckoutStep.DELIVERY_CONFIGURED);

        return deliveryComponents(session)
                .thenCompose(components -> call(session, "checkout.delivery",
                        () -> client.putCheckoutComponents(session.purchaseId, components, session.proxy)))
                .thenCompose(delivery -> afterDelivery(session, delivery));
    }

    private CompletableFuture<ObjectNode> deliveryComponents(Session session) {
        ObjectNode components = objectMapper.createObjectNode();
        ObjectNode verification = components.putObject("additional_service");
        verification.put("is_selected", wantsVerification(session.item));
        verification.put("type", "item_verification");
        components.putObject("shipping_pickup_options")
                .put("pickup_type", config.deliveryType() == SnipebotProperties.DeliveryType.HOME ? 1 : 2);

        if (config.deliveryType() != SnipebotProperties.DeliveryType.DROPOFF) {
            return CompletableFuture.completedFuture(components);
        }
        Optional<Long> shippingOrderId = CheckoutResponseParser.shippingOrderId(session.buildData);
        if (shippingOrderId.isEmpty()) {
            log.info("checkout drop-off without shipping order id, pickup point left unset purchaseId={}",
                    session.purchaseId);
            return CompletableFuture.completedFuture(components);
        }

        return call(session, "checkout.pickup-points", () -> client.nearbyPickupPoints(
                shippingOrderId.get(), config.latitude(), config.longitude(), config.countryCode(), session.proxy))
                .thenApply(points -> {
                    if (!points.ok()) {
                        log.warn("pickup point lookup failed purchaseId={} code={} message={}",
                                session.purchaseId, points.code(), points.message());
                        return components;
                    }
                    List<PickupPoint> candidates = CheckoutResponseParser.pickupPoints(points.data());
                    GeoDistance.nearest(candidates, config.latitude(), config.longitude()).ifPresentOrElse(
                            nearest -> {
                                ObjectNode details = components.putObject("shipping_pickup_details");
                                details.put("rate_uuid", nearest.rateUuid());
                                details.put("point_code", nearest.pointCode());
                                details.put("point_uuid", nearest.pointUuid());
                                log.debug("pickup point selected purchaseId={} code={} of {}",
                                        session.purchaseId, nearest.pointCode(), candidates.size());
                            },
                            () -> log.info("no pickup point candidates purchaseId={}", session.purchaseId));
                    return components;
                });
    }

    private CompletableFuture<CheckoutResult> afterDelivery(Session session, BridgeResult delivery) {
        if (!delivery.ok()) {
            return done(CheckoutResult.failed(delivery.code(), delivery.describe(), session.purchaseId));
        }
        session.advance(CheckoutStep.PAYMENT_ATTACHED);

        Optional<PaymentMethod> payment = CheckoutResponseParser.paymentMethod(delivery.data());
        if (payment.isEmpty()) {
            payment = CheckoutResponseParser.paymentMethod(session.buildData);
        }
        if (payment.isEmpty()) {
            return done(CheckoutResult.failed(null, CheckoutResult.NO_PAYMENT_METHOD, session.purchaseId));
        }

        ObjectNode components = objectMapper.createObjectNode();
        components.putObject("payment_method")
                .put("card_id", payment.get().cardId())
                .put("pay_in_method_id", payment.get().payInMethodId());

        return call(session, "checkout.payment",
                () -> client.putCheckoutComponents(session.purchaseId, components, session.proxy))
                .thenApply(paid -> afterPayment(session, paid));
    }

    private CheckoutResult afterPayment(Session session, BridgeResult paid) {
        if (!paid.ok()) {
            return CheckoutResult.failed(paid.code(), paid.describe(), session.purchaseId);
        }

        Optional<String> approvalUrl = CheckoutResponseParser.approvalUrl(paid.data());
        if (approvalUrl.isPresent()) {
            String url = approvalUrl.get();
            approvalOpener.open(url);
            events.publish(new PipelineEvent.ApprovalRequired(session.item.id(), session.purchaseId, url));
            return CheckoutResult.awaitingApproval(session.purchaseId, url);
        }

        FeedItem item = session.item;
        try {
            ledger.recordCompleted(item.id(), item.checkoutOrderId(), item.priceValue(), session.ruleId);
        } catch (RuntimeException e) {
            // purchase already went through upstream
            log.error("purchase ledger write failed itemId={} purchaseId={}", item.id(), session.purchaseId, e);
        }
        return CheckoutResult.completed(session.purchaseId);
    }

    private CheckoutResult finish(Session session, CheckoutResult result) {
        if (result.ok()) {
            session.advance(result.step());
            if (result.awaitingApproval()) {
                awaitingApprovalCounter.increment();
            } else {
                completedCounter.increment();
            }
            log.info("checkout {} itemId={} purchaseId={}", result.step(), session.item.id(), result.purchaseId());
        } else {
            failedCounter.increment();
            events.publish(new PipelineEvent.CheckoutProgress(session.item.id(), CheckoutStep.FAILED.name(),
                    result.message()));
            log.warn("checkout failed itemId={} step={} code={} message={}",
                    session.item.id(), session.step, result.code(), result.message());
        }
        return result;
    }

    private CompletableFuture<BridgeResult> call(Session session, String operation,
                                                 Supplier<CompletableFuture<BridgeResult>> request) {
        return retrier.call(operation, request).thenApply(result -> {
            if (session.proxy != null) {
                if (result.ok()) {
                    proxies.reportSuccess(session.proxy);
                } else if (result.errorCode().isIdentityDamaging()) {
                    proxies.reportForbidden(session.proxy);
                }
            }
            return result;
        });
    }

    private boolean wantsVerification(FeedItem item) {
        return config.verificationEnabled() && item.priceValue().compareTo(config.verificationThreshold()) >= 0;
    }

    private static CompletableFuture<CheckoutResult> done(CheckoutResult result) {
        return CompletableFuture.completedFuture(result);
    }

    private final class Session {
        private final FeedItem item;
        private final String proxy;
        private final Long ruleId;
        private CheckoutStep step = CheckoutStep.INIT;
        private String purchaseId;
        private JsonNode buildData;

        private Session(FeedItem item, String proxy, Long ruleId) {
            this.item = item;
            this.proxy = proxy;
            this.ruleId = ruleId;
        }

        private void advance(CheckoutStep next) {
            step = next;
            if (next.progressMessage() != null) {
                events.publish(new PipelineEvent.CheckoutProgress(item.id(), next.name(), next.progressMessage()));
            }
        }
    }
}
