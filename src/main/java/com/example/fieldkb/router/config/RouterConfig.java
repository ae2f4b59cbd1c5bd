package com.example.fieldkb.router.config;

import com.example.fieldkb.router.handler.ChatModelSpecialistHandler;
import com.example.fieldkb.router.handler.HandlerRegistry;
import com.example.fieldkb.router.handler.SpecialistHandler;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class RouterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs gap repair off the request path; never awaited by a response. */
    @Bean(name = "gapRepairScheduler", destroyMethod = "dispose")
    public Scheduler gapRepairScheduler(RouterProperties properties) {
        RouterProperties.Gap gap = properties.getGap();
        return Schedulers.newBoundedElastic(gap.getWorkerThreads(), gap.getQueueCapacity(), "gap-repair");
    }

    @Bean
    public HandlerRegistry handlerRegistry(ChatModel chatModel, RouterProperties properties) {
        RouterProperties.Handler handler = properties.getHandler();
        Map<String, SpecialistHandler> handlers = new LinkedHashMap<>();
        handlers.put(HandlerRegistry.GENERIC,
                new ChatModelSpecialistHandler(HandlerRegistry.GENERIC, chatModel, handler.getGenericPrompt()));
        handlers.put(HandlerRegistry.FALLBACK,
                new ChatModelSpecialistHandler(HandlerRegistry.FALLBACK, chatModel, handler.getFallbackPrompt()));
        handler.getSpecialists().forEach((key, prompt) ->
                handlers.put(key, new ChatModelSpecialistHandler(key, chatModel, prompt)));
        return new HandlerRegistry(handlers);
    }
}
