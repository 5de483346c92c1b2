package tech.yump.passkeeper.auth.policy;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.Set;

/**
 * One row of the access table: the roles allowed to call a named operation.
 */
public record OperationRule(
        @NotBlank(message = "Access rule operation cannot be blank")
        String operation,
        @NotEmpty(message = "Access rule must allow at least one role")
        Set<String> roles
) {
}
