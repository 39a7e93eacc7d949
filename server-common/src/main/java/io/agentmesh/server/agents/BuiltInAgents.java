package io.agentmesh.server.agents;

/**
 * Registers the bundled agents and their keyword routes, in priority order: calculator, analysis,
 * memory, with echo as the fallback.
 */
public final class BuiltInAgents {

    private BuiltInAgents() {
    }

    public static MessageRouter install(AgentRegistry registry) {
        registry.register(EchoAgent.identity());
        registry.register(CalculatorAgent.identity());
        registry.register(AnalysisAgent.identity());
        registry.register(MemoryAgent.identity());

        MessageRouter router = new MessageRouter(registry, EchoAgent.NAME);
        router.addRoute("calculator", new KeywordPredicate(CalculatorAgent.KEYWORDS), CalculatorAgent.NAME);
        router.addRoute("analysis", new KeywordPredicate(AnalysisAgent.KEYWORDS), AnalysisAgent.NAME);
        router.addRoute("memory", new KeywordPredicate(MemoryAgent.KEYWORDS), MemoryAgent.NAME);
        return router;
    }
}
