package com.coordinator.core;

/**
 * Thrown when an agent template is requested for a role the provider does not define.
 */
public class UnknownRoleException extends CoordinatorException {
    public UnknownRoleException(String role) {
        super("Unknown agent role: " + role);
    }
}
