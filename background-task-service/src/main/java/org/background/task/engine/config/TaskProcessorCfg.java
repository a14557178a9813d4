package org.background.task.engine.config;

import org.background.task.engine.core.processor.TaskProcessor;
import org.background.task.engine.core.processor.TaskProcessorManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Registers every {@link TaskProcessor} bean in the context. Kinds without a bean fall back to the
 * built-in staged processor.
 */
@Configuration
public class TaskProcessorCfg {

    @Bean
    public TaskProcessorManager taskProcessorManager(ObjectProvider<TaskProcessor> processors,
                                                     TaskEngineConfig config) {
        List<TaskProcessor> provided = processors.orderedStream().toList();
        return TaskProcessorManager.withDefaults(provided, config.getStepDelayScale());
    }
}
