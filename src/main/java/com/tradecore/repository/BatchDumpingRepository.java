package com.tradecore.repository;

import com.tradecore.domain.model.DumpResult;
import java.io.IOException;

/** A streaming repository that persists its buffer as batch files. */
public interface BatchDumpingRepository extends ManagedRepository {

    /**
     * Writes everything currently buffered to a new batch file and clears the buffer.
     * On failure the buffer keeps its contents.
     *
     * @return the written file and record count, or an empty result if nothing was buffered
     */
    DumpResult forceDump() throws IOException;
}
