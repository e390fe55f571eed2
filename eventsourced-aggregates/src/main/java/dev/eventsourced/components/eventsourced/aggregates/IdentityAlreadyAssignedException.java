package dev.eventsourced.components.eventsourced.aggregates;

import static com.google.common.base.Strings.lenientFormat;

public class IdentityAlreadyAssignedException extends AggregateException {
    public final Class<?> aggregateType;
    public final String   assignedIdentity;
    public final String   rejectedIdentity;

    public IdentityAlreadyAssignedException(Class<?> aggregateType, String assignedIdentity, String rejectedIdentity) {
        super(lenientFormat("Aggregate '%s' already has identity '%s' and cannot be assigned identity '%s'",
                            aggregateType != null ? aggregateType.getName() : null,
                            assignedIdentity,
                            rejectedIdentity));
        this.aggregateType = aggregateType;
        this.assignedIdentity = assignedIdentity;
        this.rejectedIdentity = rejectedIdentity;
    }
}
