package com.tradecore.repository;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;

/** Common identity of every repository handed out by the factory. */
public interface ManagedRepository {

    RepositoryKind kind();

    /** The backend actually in use, which differs from the configured one after a fallback. */
    StorageBackend backend();

    /** Releases executors and other resources. The repository must not be used afterwards. */
    default void close() {}
}
