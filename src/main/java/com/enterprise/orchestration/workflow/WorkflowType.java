package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.core.TaskType;
import com.enterprise.orchestration.dependency.ParameterBinding;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in workflow types
 */
public enum WorkflowType implements WorkflowTemplate {

    /** One task whose type is named by the {@code task_type} parameter */
    SINGLE_TASK("single_task") {
        @Override
        public List<TaskSpec> expand(Map<String, Object> parameters) {
            Object tag = parameters.get(TASK_TYPE_PARAMETER);
            if (tag == null) {
                throw new IllegalArgumentException("single_task requires the '" + TASK_TYPE_PARAMETER + "' parameter");
            }
            TaskType taskType = TaskType.fromTag(tag.toString())
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + tag));

            Map<String, Object> taskParameters = new LinkedHashMap<>(parameters);
            taskParameters.remove(TASK_TYPE_PARAMETER);
            return List.of(TaskSpec.of(taskType, taskParameters));
        }
    },

    CREATE_PR("create_pr") {
        @Override
        public List<TaskSpec> expand(Map<String, Object> parameters) {
            return List.of(TaskSpec.of(TaskType.CREATE_PR, parameters));
        }
    },

    PR_WITH_REPORT("pr_with_report") {
        @Override
        public List<TaskSpec> expand(Map<String, Object> parameters) {
            return List.of(
                TaskSpec.of(TaskType.CREATE_PR, parameters),
                TaskSpec.of(TaskType.GENERATE_REPORT).bind(0, PR_NUMBER)
            );
        }
    },

    CREATE_BRANCH("create_branch") {
        @Override
        public List<TaskSpec> expand(Map<String, Object> parameters) {
            return List.of(
                TaskSpec.of(TaskType.CREATE_BRANCH, parameters),
                TaskSpec.of(TaskType.PUSH_BRANCH, parameters).after(0)
            );
        }
    },

    BRANCH_AND_PR("branch_and_pr") {
        @Override
        public List<TaskSpec> expand(Map<String, Object> parameters) {
            return List.of(
                TaskSpec.of(TaskType.CREATE_BRANCH, parameters),
                TaskSpec.of(TaskType.CREATE_PR, parameters).after(0)
            );
        }
    },

    FULL_BRANCH_WORKFLOW("full_branch_workflow") {
        @Override
        public List<TaskSpec> expand(Map<String, Object> parameters) {
            return List.of(
                TaskSpec.of(TaskType.CREATE_BRANCH, parameters),
                TaskSpec.of(TaskType.PUSH_BRANCH, parameters).after(0),
                TaskSpec.of(TaskType.CREATE_PR, parameters).after(1),
                TaskSpec.of(TaskType.GENERATE_REPORT).bind(2, PR_NUMBER)
            );
        }
    };

    public static final String TASK_TYPE_PARAMETER = "task_type";

    /** Reports take the pull request number from whichever field the executor filled in */
    private static final ParameterBinding PR_NUMBER = ParameterBinding.of("pr_number", "pr_id", "pr_number");

    private final String name;

    WorkflowType(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    public static Optional<WorkflowType> fromName(String name) {
        return Arrays.stream(values())
            .filter(type -> type.name.equals(name))
            .findFirst();
    }
}
