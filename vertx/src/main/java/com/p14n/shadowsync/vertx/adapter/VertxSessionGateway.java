package com.p14n.shadowsync.vertx.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.codec.ShadowDeltaCodec;
import com.p14n.shadowsync.notify.SessionGateway;
import com.p14n.shadowsync.notify.ShadowChangeNotifier;
import com.p14n.shadowsync.shadow.ShadowDelta;

import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;

/**
 * Pushes deltas to {@code shadowsync.session.<sessionId>} as JSON strings, for
 * a WebSocket or SockJS bridge to forward to the browser.
 */
public class VertxSessionGateway implements SessionGateway {

    private static final Logger logger = LoggerFactory.getLogger(VertxSessionGateway.class);

    public static final String ADDRESS_PREFIX = "shadowsync.session.";

    private final EventBus eventBus;

    public VertxSessionGateway(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public static String addressOf(String sessionId) {
        return ADDRESS_PREFIX + sessionId;
    }

    @Override
    public void pushToSession(String sessionId, ShadowDelta delta) {
        DeliveryOptions options = new DeliveryOptions()
                .addHeader(ShadowChangeNotifier.DEVICE_HEADER, delta.deviceId())
                .addHeader(ShadowChangeNotifier.VERSION_HEADER, Long.toString(delta.toVersion()));
        eventBus.publish(addressOf(sessionId), ShadowDeltaCodec.toJson(delta).toString(), options);
        logger.atDebug().addArgument(delta::deviceId).addArgument(delta::toVersion).addArgument(sessionId)
                .log("Pushed {} version {} to session {}");
    }
}
