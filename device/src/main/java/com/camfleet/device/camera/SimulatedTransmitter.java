package com.camfleet.device.camera;

import com.camfleet.core.model.ChargingState;
import com.camfleet.core.model.Telemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transmitter that publishes nothing and reports plausible telemetry, so a device server can run
 * on hardware without a capture pipeline.
 */
public class SimulatedTransmitter implements StreamTransmitter {
    private static final Logger log = LoggerFactory.getLogger(SimulatedTransmitter.class);

    private final AtomicReference<TransmitterConfig> active = new AtomicReference<>();
    private final AtomicInteger keyframes = new AtomicInteger();
    private final AtomicInteger droppedFrames = new AtomicInteger();
    private final long startedAtMillis = System.currentTimeMillis();

    @Override
    public Mono<Void> start(TransmitterConfig config) {
        return Mono.fromRunnable(() -> {
            TransmitterConfig previous = active.getAndSet(config);
            if (previous != null) {
                log.info("Restarting stream {} -> {}@{}fps", previous.getResolution(),
                        config.getResolution(), config.getFps());
            } else {
                log.info("Stream '{}' started: {}@{}fps {} {}bps", config.getSourceName(),
                        config.getResolution(), config.getFps(), config.getCodec(), config.getBitrate());
            }
            droppedFrames.set(0);
        });
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (active.getAndSet(null) != null) {
                log.info("Stream stopped");
            }
        });
    }

    @Override
    public Mono<Void> forceKeyframe() {
        return Mono.fromRunnable(() -> {
            if (active.get() == null) {
                throw new IllegalStateException("Stream is not running");
            }
            log.debug("Keyframe #{} requested", keyframes.incrementAndGet());
        });
    }

    @Override
    public Telemetry currentTelemetry() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        TransmitterConfig config = active.get();

        double uptimeMin = (System.currentTimeMillis() - startedAtMillis) / 60_000.0;
        double battery = Math.max(0.05, 1.0 - uptimeMin / 600.0);

        Telemetry.TelemetryBuilder builder = Telemetry.builder()
                .battery(battery)
                .tempC(34.0 + random.nextDouble(0, 4))
                .wifiRssi(-45 - random.nextInt(20))
                .cpuUsage(config == null ? 0.05 : 0.35 + random.nextDouble(0, 0.1))
                .chargingState(battery > 0.99 ? ChargingState.FULL : ChargingState.UNPLUGGED);

        if (config == null) {
            return builder.fps(0).bitrate(0).queueMs(0).droppedFrames(0).build();
        }
        if (random.nextInt(100) == 0) {
            droppedFrames.incrementAndGet();
        }
        return builder
                .fps(config.getFps() - random.nextDouble(0, 0.3))
                .bitrate((int) (config.getBitrate() * (0.95 + random.nextDouble(0, 0.05))))
                .queueMs(5 + random.nextInt(10))
                .droppedFrames(droppedFrames.get())
                .build();
    }

    @Override
    public Mono<Void> updateSettings(TransmitterConfig settings) {
        return Mono.fromRunnable(() -> {
            if (active.get() == null) {
                throw new IllegalStateException("Stream is not running");
            }
            active.set(settings);
            log.info("Encoder reconfigured: {}@{}fps {} {}bps", settings.getResolution(), settings.getFps(),
                    settings.getCodec(), settings.getBitrate());
        });
    }

    @Override
    public boolean isActive() {
        return active.get() != null;
    }

    public int getKeyframeCount() {
        return keyframes.get();
    }
}
