package com.questrail.devicelink.cli;

import com.questrail.devicelink.api.Command;
import com.questrail.devicelink.api.CommandOutcome;
import com.questrail.devicelink.api.DeviceEndpoint;
import com.questrail.devicelink.config.DeviceDirectory;
import com.questrail.devicelink.config.TransportConfig;
import com.questrail.devicelink.observability.Slf4jCommandObservabilitySink;
import com.questrail.devicelink.runtime.DeviceLinkRuntime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.TypeConversionException;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line harness: sends one toggle command to one device and reports the
 * terminal outcome through the exit status (0 success, 1 failure, 2 usage).
 */
@CommandLine.Command(
    name = "devicelink-toggle",
    version = "0.1.0",
    description = "Toggle a networked device with retry, idempotency and structured logging",
    mixinStandardHelpOptions = true,
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  devicelink-toggle --device-id lamp-1 --device-host 192.168.1.40 --state off",
        ""
    }
)
public class ToggleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ToggleCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    @Option(names = {"--device-id"}, description = "Device identifier", required = true)
    private String deviceId;

    @Option(names = {"--device-host"}, description = "Device IP address or hostname", required = true)
    private String deviceHost;

    @Option(
        names = {"--device-port"},
        description = "Device port (default: ${DEFAULT-VALUE})",
        defaultValue = "9000"
    )
    private int devicePort;

    @Option(
        names = {"--state"},
        description = "Desired state: on/off, true/false or 1/0 (default: ${DEFAULT-VALUE})",
        defaultValue = "on",
        converter = DesiredStateConverter.class
    )
    private boolean desiredState;

    @Option(
        names = {"--max-attempts"},
        description = "Maximum attempts, first attempt included (default: ${DEFAULT-VALUE})",
        defaultValue = "2"
    )
    private int maxAttempts;

    @Option(
        names = {"--connect-timeout-ms"},
        description = "Connect timeout in milliseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "1000"
    )
    private long connectTimeoutMs;

    @Option(
        names = {"--response-timeout-ms"},
        description = "Response timeout per attempt in milliseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "1500"
    )
    private long responseTimeoutMs;

    @Option(
        names = {"--backoff-base-ms"},
        description = "Base retry backoff in milliseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "250"
    )
    private long backoffBaseMs;

    @Option(
        names = {"--reuse-session"},
        description = "Keep a connected session for the next attempt instead of reconnecting"
    )
    private boolean reuseSession;

    @Override
    public Integer call() {
        TransportConfig config;
        DeviceDirectory devices;
        try {
            config = TransportConfig.builder()
                    .withMaxAttempts(maxAttempts)
                    .withConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                    .withResponseTimeout(Duration.ofMillis(responseTimeoutMs))
                    .withBackoffBase(Duration.ofMillis(backoffBaseMs))
                    .withReuseSession(reuseSession)
                    .build();
            devices = DeviceDirectory.single(deviceId, new DeviceEndpoint(deviceHost, devicePort));
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        try (DeviceLinkRuntime runtime = DeviceLinkRuntime.builder()
                .withDevices(devices)
                .withTransportConfig(config)
                .withObservabilitySink(new Slf4jCommandObservabilitySink())
                .withMeterRegistry(registry)
                .build()) {

            Command command = Command.toggle(deviceId, desiredState);
            log.info("Starting toggle device_id={} host={} port={} state={} msg_id={}",
                    deviceId, deviceHost, devicePort, desiredState ? "on" : "off", command.msgId());

            CommandOutcome outcome = runtime.execute(command);
            logMeterSummary(registry);

            if (outcome.isSuccess()) {
                log.info("Device toggle completed successfully: {}", outcome.detail());
                return EXIT_SUCCESS;
            }
            log.error("Device toggle failed: reason={} detail={}", outcome.reason(), outcome.detail());
            return EXIT_FAILURE;
        } finally {
            registry.close();
        }
    }

    private static void logMeterSummary(SimpleMeterRegistry registry) {
        double sent = registry.find("devicelink.packet.sent").counters().stream().mapToDouble(Counter::count).sum();
        double retransmits = registry.find("devicelink.retransmit").counters().stream().mapToDouble(Counter::count).sum();
        double stray = registry.find("devicelink.stray.response").counters().stream().mapToDouble(Counter::count).sum();
        log.debug("Metrics packets_sent={} retransmits={} stray_responses={}", (long) sent, (long) retransmits, (long) stray);
    }

    /**
     * Accepts on/off, true/false and 1/0, case-insensitively.
     */
    static final class DesiredStateConverter implements ITypeConverter<Boolean> {
        @Override
        public Boolean convert(String value) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "on":
                case "true":
                case "1":
                    return Boolean.TRUE;
                case "off":
                case "false":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw new TypeConversionException("Expected on/off, true/false or 1/0 but was '" + value + "'");
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ToggleCommand())
            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
            .execute(args);
        System.exit(exitCode);
    }
}
