package com.p14n.shadowsync;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.shadowsync.broker.NotConnectedException;
import com.p14n.shadowsync.codec.JsonUtil;
import com.p14n.shadowsync.data.Envelope;

/**
 * Drives a set of simulated heaters against an engine. Every tick each heater
 * picks up a pending target from its shadow, moves its temperature and reports
 * the result on its reported topic. Every tenth tick an operator sets a new
 * target on one heater.
 */
public class WaterHeaterFleet {

    private static final Logger logger = LoggerFactory.getLogger(WaterHeaterFleet.class);

    static final String TEMPERATURE = "temperature";
    static final String TARGET = "target_temperature";
    static final String HEATING = "heating";

    private final ShadowSyncEngine engine;
    private final List<WaterHeater> heaters;
    private final Random random;
    private long ticks;

    public WaterHeaterFleet(ShadowSyncEngine engine, List<String> deviceIds, Random random) {
        this.engine = engine;
        this.random = random;
        this.heaters = deviceIds.stream()
                .map(id -> new WaterHeater(id, 100 + random.nextInt(30)))
                .collect(Collectors.toList());
    }

    public List<WaterHeater> heaters() {
        return heaters;
    }

    public void tick() {
        ticks++;
        if (ticks % 10 == 0) {
            WaterHeater heater = heaters.get(random.nextInt(heaters.size()));
            int target = 110 + random.nextInt(31);
            engine.patchDesired(heater.deviceId(), Map.of(TARGET, target));
            logger.atInfo().addArgument(heater::deviceId).addArgument(target).log("Operator set {} target to {}");
        }
        for (WaterHeater heater : heaters) {
            step(heater);
        }
    }

    void step(WaterHeater heater) {
        Map<String, JsonNode> pending = engine.pendingDelta(heater.deviceId());
        JsonNode target = pending.get(TARGET);
        if (target != null && target.canConvertToInt()) {
            heater.applyTarget(target.asInt());
        }
        heater.step();
        try {
            engine.connection().publish(Envelope.json(engine.topics().reported(heater.deviceId()),
                    report(heater).toString(), System.currentTimeMillis()));
        } catch (NotConnectedException e) {
            logger.atWarn().addArgument(heater::deviceId).log("Not connected, skipping report for {}");
        }
    }

    static ObjectNode report(WaterHeater heater) {
        ObjectNode report = JsonUtil.newObject();
        report.put(TEMPERATURE, heater.temperature());
        report.put(TARGET, heater.target());
        report.put(HEATING, heater.heating());
        return report;
    }
}
