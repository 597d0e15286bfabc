package com.p14n.shadowsync.notify;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.broker.AsyncExecutor;
import com.p14n.shadowsync.broker.BrokerConnection;
import com.p14n.shadowsync.broker.NotConnectedException;
import com.p14n.shadowsync.codec.ShadowDeltaCodec;
import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.shadow.ShadowDelta;
import com.p14n.shadowsync.shadow.ShadowDeltaListener;
import com.p14n.shadowsync.topic.ShadowTopics;
import com.p14n.shadowsync.topic.TopicPattern;

/**
 * Publishes shadow deltas on the device's update topic and pushes them to
 * locally registered sessions whose pattern matches that topic.
 *
 * <p>
 * Neither path can fail the caller: broker errors are logged (an outage is
 * covered by the connection's own buffering) and session pushes run on the
 * executor.
 * </p>
 */
public class ShadowChangeNotifier implements ShadowDeltaListener {

    private static final Logger logger = LoggerFactory.getLogger(ShadowChangeNotifier.class);

    public static final String VERSION_HEADER = "shadow-version";
    public static final String DEVICE_HEADER = "device-id";

    private final BrokerConnection connection;
    private final ShadowTopics topics;
    private final SessionGateway gateway;
    private final AsyncExecutor executor;
    private final Map<String, TopicPattern> sessions = new ConcurrentHashMap<>();

    public ShadowChangeNotifier(BrokerConnection connection, ShadowTopics topics, SessionGateway gateway,
            AsyncExecutor executor) {
        this.connection = connection;
        this.topics = topics;
        this.gateway = gateway;
        this.executor = executor;
    }

    @Override
    public void onDelta(String deviceId, ShadowDelta delta) {
        notify(deviceId, delta);
    }

    public void notify(String deviceId, ShadowDelta delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        String topic = topics.update(deviceId);
        publish(topic, deviceId, delta);
        fanOut(topic, delta);
    }

    /**
     * Routes deltas whose update topic matches the pattern to the session.
     * Registering an existing session id replaces its pattern.
     */
    public void registerSession(String sessionId, String pattern) {
        if (sessionId == null || sessionId.isEmpty()) {
            throw new IllegalArgumentException("Session id cannot be null or empty");
        }
        sessions.put(sessionId, TopicPattern.of(pattern));
        logger.atDebug().addArgument(sessionId).addArgument(pattern).log("Session {} watching {}");
    }

    public boolean unregisterSession(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    public int sessionCount() {
        return sessions.size();
    }

    private void publish(String topic, String deviceId, ShadowDelta delta) {
        Envelope envelope = Envelope.create(topic, ShadowDeltaCodec.toBytes(delta), Map.of(
                VERSION_HEADER, Long.toString(delta.toVersion()),
                DEVICE_HEADER, deviceId));
        try {
            connection.publish(envelope);
        } catch (NotConnectedException e) {
            logger.atError().setCause(e).addArgument(topic).addArgument(delta.toVersion())
                    .log("Unable to publish delta on {} for version {}");
        }
    }

    private void fanOut(String topic, ShadowDelta delta) {
        if (gateway == null) {
            return;
        }
        sessions.forEach((sessionId, pattern) -> {
            if (!pattern.matches(topic)) {
                return;
            }
            try {
                executor.submit(() -> {
                    push(sessionId, delta);
                    return null;
                });
            } catch (RejectedExecutionException e) {
                logger.atError().setCause(e).addArgument(sessionId).log("Unable to schedule push to session {}");
            }
        });
    }

    private void push(String sessionId, ShadowDelta delta) {
        try {
            gateway.pushToSession(sessionId, delta);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).addArgument(sessionId).addArgument(delta.deviceId())
                    .log("Push to session {} failed for {}");
        }
    }
}
