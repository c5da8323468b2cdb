package io.forged.cli;

import io.forged.config.EventBusConfig;
import io.forged.events.EventBus;
import io.forged.events.EventReceiver;
import io.forged.events.InvalidCursorException;
import io.forged.events.SubscribeRequest;
import io.forged.events.Subscription;
import io.forged.model.Event;
import io.forged.model.EventJson;
import io.forged.observability.PrometheusFormatter;
import io.forged.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "forged-events",
        mixinStandardHelpOptions = true,
        description = "forged daemon event bus tooling",
        subcommands = {
                ForgedEventsCommand.SettingsCommand.class,
                ForgedEventsCommand.SimulateCommand.class
        }
)
public final class ForgedEventsCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Daemon data root holding " + EventBusConfig.SETTINGS_FILE_NAME, defaultValue = "data")
    String root;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: settings | simulate");
    }

    EventBusConfig config() {
        return EventBusConfig.fromRoot(root);
    }

    @Command(name = "settings", description = "Print the resolved event bus settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ForgedEventsCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().getOut().println(Jsons.toJson(parent.config().toView()));
            return 0;
        }
    }

    @Command(name = "simulate", description = "Publish synthetic events, then replay and stream them through a filtered subscription")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        ForgedEventsCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--count"}, defaultValue = "8", description = "Events published before subscribing")
        int count;

        @Option(names = {"--live"}, defaultValue = "4", description = "Events published after subscribing")
        int live;

        @Option(names = {"--agents"}, defaultValue = "3", description = "Distinct synthetic agent ids")
        int agents;

        @Option(names = {"--cursor"}, defaultValue = "", description = "Replay cursor (empty = live only)")
        String cursor;

        @Option(names = {"--kind"}, split = ",", description = "Event kind codes to include")
        List<Integer> kinds;

        @Option(names = {"--agent"}, split = ",", description = "Agent ids to include")
        List<String> agentIds;

        @Option(names = {"--workspace"}, split = ",", description = "Workspace ids to include")
        List<String> workspaceIds;

        @Option(names = {"--metrics"}, description = "Print Prometheus metrics after the run")
        boolean metrics;

        @Option(names = {"--namespace"}, defaultValue = "", description = "Namespace label for metrics")
        String namespace;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            EventBus bus = new EventBus(parent.config());
            int agentCount = Math.max(1, agents);
            for (int i = 0; i < Math.max(0, count); i++) {
                publishSynthetic(bus, i, agentCount);
            }
            SubscribeRequest request = new SubscribeRequest(cursor, kinds, agentIds, workspaceIds);
            Subscription subscription;
            try {
                subscription = bus.subscribe(request);
            } catch (InvalidCursorException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return 2;
            }
            List<Event> delivered = new ArrayList<>();
            try (EventReceiver receiver = subscription.receiver()) {
                for (Event event : subscription.replay()) {
                    out.println(EventJson.toJsonLine(event));
                }
                int base = Math.max(0, count);
                for (int i = 0; i < Math.max(0, live); i++) {
                    publishSynthetic(bus, base + i, agentCount);
                }
                receiver.drainTo(delivered);
            }
            for (Event event : delivered) {
                out.println(EventJson.toJsonLine(event));
            }
            if (metrics) {
                out.print(PrometheusFormatter.format(bus.stats(), namespace));
            }
            out.flush();
            return 0;
        }

        static Event publishSynthetic(EventBus bus, int seq, int agentCount) {
            String agentId = "agent-" + (seq % agentCount + 1);
            String workspaceId = "ws-" + (seq % 2 + 1);
            return switch (seq % 4) {
                case 0 -> bus.publishAgentStateChanged(agentId, workspaceId, 1, 2, "simulated transition " + seq);
                case 1 -> bus.publishPaneContentChanged(agentId, workspaceId, Integer.toHexString(31 * seq + 7), seq % 40 + 1);
                case 2 -> bus.publishResourceViolation(agentId, workspaceId, 1, 90.0 + seq % 10, 80.0, seq % 3 + 1, 1);
                default -> bus.publishError(agentId, workspaceId, "SIMULATED", "simulated failure " + seq, true);
            };
        }
    }
}
