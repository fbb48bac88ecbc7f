package io.reposync.model;

/**
 * Identity of a repository at its host: the stable host-side id plus the service it came from.
 */
public record ExternalRepoSpec(String id, String serviceType, String serviceId) {
    public ExternalRepoSpec {
        id = id == null ? "" : id;
        serviceType = serviceType == null ? "" : serviceType;
        serviceId = serviceId == null ? "" : serviceId;
    }

    public boolean isEmpty() {
        return id.isEmpty() && serviceType.isEmpty() && serviceId.isEmpty();
    }

    @Override
    public String toString() {
        return serviceType + ":" + serviceId + ":" + id;
    }
}
