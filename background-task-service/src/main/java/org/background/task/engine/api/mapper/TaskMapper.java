package org.background.task.engine.api.mapper;

import org.background.task.engine.api.dto.TaskView;
import org.background.task.engine.api.exception.InvalidTaskException;
import org.background.task.engine.core.model.BackgroundTask;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskPriority;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.util.List;

@Mapper(componentModel = "spring")
public interface TaskMapper {

    @Mapping(target = "taskType", source = "kind", qualifiedByName = "kindToValue")
    TaskView toView(BackgroundTask task);

    List<TaskView> toViews(List<BackgroundTask> tasks);

    @Named("kindToValue")
    default String kindToValue(TaskKind kind) {
        return kind != null ? kind.getValue() : null;
    }

    default TaskKind toKind(String taskType) {
        try {
            return TaskKind.fromValue(taskType);
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException(e.getMessage());
        }
    }

    default TaskPriority toPriority(String priority) {
        try {
            return TaskPriority.fromValueOrDefault(priority);
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException(e.getMessage());
        }
    }
}
