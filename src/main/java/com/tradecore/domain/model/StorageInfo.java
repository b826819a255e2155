package com.tradecore.domain.model;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import lombok.Builder;
import lombok.Value;

/** Configured versus actual backend of one repository kind. */
@Value
@Builder
public class StorageInfo {

    RepositoryKind kind;
    StorageBackend configured;

    /** Null until the repository is first requested. */
    StorageBackend actual;

    boolean instantiated;

    /** Why the configured backend could not be used, or null. */
    String fallbackReason;
}
