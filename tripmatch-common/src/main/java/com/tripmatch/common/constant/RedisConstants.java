package com.tripmatch.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 训练任务单 leader 租约 key */
    public static final String LOCK_TRAINING_KEY = "lock:training:run";
}
