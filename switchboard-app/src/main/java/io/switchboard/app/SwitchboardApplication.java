package io.switchboard.app;

import io.switchboard.cli.CliContext;
import io.switchboard.cli.OwnerStoreFactory;
import io.switchboard.cli.SwitchboardCliCommand;
import io.switchboard.core.api.GatewayServer;
import io.switchboard.core.config.ConfigPaths;
import io.switchboard.core.config.ConfigService;
import io.switchboard.core.config.model.GenesysConfig;
import io.switchboard.core.config.model.PromptsConfig;
import io.switchboard.core.config.model.ProviderConfig;
import io.switchboard.core.config.model.SwitchboardConfig;
import io.switchboard.core.conversation.SqliteConversationStore;
import io.switchboard.core.correlation.CorrelationRegistry;
import io.switchboard.core.db.SqliteDatabase;
import io.switchboard.core.external.DisabledForwarder;
import io.switchboard.core.external.ExternalForwarder;
import io.switchboard.core.external.GenesysOpenMessagingForwarder;
import io.switchboard.core.external.VendorEventParser;
import io.switchboard.core.fanout.ConversationRooms;
import io.switchboard.core.memory.HeuristicMemoryExtractor;
import io.switchboard.core.memory.LlmMemoryExtractor;
import io.switchboard.core.memory.MemoryExtractor;
import io.switchboard.core.memory.SqliteMemoryStore;
import io.switchboard.core.oracle.DecisionOracle;
import io.switchboard.core.oracle.LlmDecisionOracle;
import io.switchboard.core.oracle.OraclePrompts;
import io.switchboard.core.oracle.ReplyComposer;
import io.switchboard.core.owner.SqliteOwnerStore;
import io.switchboard.core.provider.DisabledProvider;
import io.switchboard.core.provider.LlmProvider;
import io.switchboard.core.provider.OpenAiCompatProvider;
import io.switchboard.core.provider.ProviderRegistry;
import io.switchboard.core.routing.InboundRouter;
import io.switchboard.core.routing.OutboundRelay;
import io.switchboard.core.routing.RelaySettings;
import io.switchboard.core.routing.RelayStores;
import io.switchboard.core.tool.ToolRegistry;
import io.switchboard.core.tool.impl.CheckExternalSessionTool;
import io.switchboard.core.tool.impl.ConnectLiveAgentTool;
import io.switchboard.core.transcript.SqliteTranscriptStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SwitchboardApplication {
    private static final Logger LOG = LoggerFactory.getLogger(SwitchboardApplication.class);

    private SwitchboardApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            portOverride -> runGateway(configService, configPath, portOverride),
            OwnerStoreFactory.sqlite()
        );

        int exitCode = SwitchboardCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static int runGateway(ConfigService configService, Path configPath, Integer portOverride) throws Exception {
        SwitchboardConfig config = configService.load(configPath);
        Clock clock = Clock.systemUTC();

        SqliteDatabase database = new SqliteDatabase(ConfigPaths.resolve(config.storage().databasePath()));
        RelayStores stores = new RelayStores(
            new SqliteOwnerStore(database, clock),
            new SqliteConversationStore(database, clock),
            new SqliteTranscriptStore(database, clock),
            new SqliteMemoryStore(database, clock)
        );

        LlmProvider llm = buildProviderChain(config);
        OraclePrompts prompts = loadPrompts(config.prompts());
        DecisionOracle oracle = new LlmDecisionOracle(llm, config.llm().model(), config.llm().temperature(), prompts);

        ToolRegistry tools = new ToolRegistry();
        tools.register(new CheckExternalSessionTool());
        tools.register(new ConnectLiveAgentTool());
        ReplyComposer replyComposer = new ReplyComposer(llm, config.llm().replyModel(), prompts, tools);

        CorrelationRegistry registry = new CorrelationRegistry(stores.conversations());
        ExternalForwarder forwarder = buildForwarder(config.genesys(), clock);
        ConversationRooms fanout = new ConversationRooms();
        RelaySettings settings = new RelaySettings(config.routing().historyWindow(), config.genesys().deploymentId());

        InboundRouter inboundRouter = new InboundRouter(
            stores,
            oracle,
            replyComposer,
            buildMemoryExtractor(config, llm, prompts),
            registry,
            forwarder,
            fanout,
            settings
        );
        OutboundRelay outboundRelay = new OutboundRelay(
            stores,
            new VendorEventParser(),
            oracle,
            registry,
            forwarder,
            fanout,
            settings
        );

        int port = portOverride == null ? config.server().port() : portOverride;
        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(
            config.server().host(),
            port,
            config.server().webhookToken(),
            config.server().corsOrigins(),
            stores,
            inboundRouter,
            outboundRelay,
            fanout
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Switchboard started on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: /conversations, POST /webhooks/messages, WS /ws?token=<api token>, GET /healthz");
            shutdown.await();
        }
        return 0;
    }

    private static LlmProvider buildProviderChain(SwitchboardConfig config) {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(buildOpenAiCompatProvider("openai", config.providers().openai(), "https://api.openai.com/v1"));
        registry.register(buildOpenAiCompatProvider("openrouter", config.providers().openrouter(), "https://openrouter.ai/api/v1"));
        return registry.chain("switchboard", config.llm().providerChain());
    }

    private static LlmProvider buildOpenAiCompatProvider(
        String name,
        ProviderConfig providerConfig,
        String defaultBase
    ) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? defaultBase
                : providerConfig.apiBase();
            Map<String, String> headers = providerConfig.extraHeaders() == null ? Map.of() : providerConfig.extraHeaders();
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, headers);
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static ExternalForwarder buildForwarder(GenesysConfig genesys, Clock clock) {
        if (!genesys.configured()) {
            LOG.warn("Genesys credentials are incomplete; messages for live agents will not be delivered");
            return new DisabledForwarder("Genesys credentials are not configured");
        }
        return new GenesysOpenMessagingForwarder(
            genesys.resolvedApiBase(),
            genesys.resolvedLoginBase(),
            genesys.clientId(),
            genesys.clientSecret(),
            Duration.ofSeconds(Math.max(1, genesys.timeoutSeconds())),
            clock
        );
    }

    private static MemoryExtractor buildMemoryExtractor(SwitchboardConfig config, LlmProvider llm, OraclePrompts prompts) {
        String mode = config.memory().mode() == null ? "llm" : config.memory().mode().trim().toLowerCase(Locale.ROOT);
        boolean llmAvailable = config.providers().openai().configured() || config.providers().openrouter().configured();
        return switch (mode) {
            case "off" -> MemoryExtractor.disabled();
            case "heuristic" -> new HeuristicMemoryExtractor();
            default -> {
                if (!llmAvailable) {
                    LOG.info("No LLM provider configured; using heuristic memory extraction");
                    yield new HeuristicMemoryExtractor();
                }
                yield new LlmMemoryExtractor(llm, config.llm().model(), prompts);
            }
        };
    }

    private static OraclePrompts loadPrompts(PromptsConfig prompts) throws IOException {
        return OraclePrompts.load(
            ConfigPaths.resolve(prompts.routing()),
            ConfigPaths.resolve(prompts.externalResponse()),
            ConfigPaths.resolve(prompts.memoryExtraction()),
            ConfigPaths.resolve(prompts.reply())
        );
    }
}
