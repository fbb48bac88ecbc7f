package io.reposync.source;

import io.reposync.model.ExternalService;

@FunctionalInterface
public interface Sourcer {
    Source forService(ExternalService service);
}
