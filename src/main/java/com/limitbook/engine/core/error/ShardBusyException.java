package com.limitbook.engine.core.error;

import lombok.Getter;

/**
 * Shard write lock not acquired within the configured timeout. Nothing was mutated.
 */
@Getter
public class ShardBusyException extends EngineException {
    private final int shardIndex;

    public ShardBusyException(int shardIndex) {
        super("Shard " + shardIndex + " is busy");
        this.shardIndex = shardIndex;
    }

    public ShardBusyException(int shardIndex, Throwable cause) {
        super("Interrupted while waiting for shard " + shardIndex, cause);
        this.shardIndex = shardIndex;
    }
}
