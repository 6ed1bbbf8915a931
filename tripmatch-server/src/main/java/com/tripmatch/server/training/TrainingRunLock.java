package com.tripmatch.server.training;

import com.tripmatch.common.constant.RedisConstants;
import com.tripmatch.common.properties.TrainingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 训练任务互斥锁：本地 ReentrantLock 保证实例内只有一个任务，
 * 开启分布式锁时再用 Redis SET NX + 租约保证多实例下只有一个 leader。
 *
 * <p>Redis 不可用时本次不获取锁（跳过训练），不会降级为只用本地锁。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingRunLock {

    private static final DefaultRedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
                    "return redis.call('del', KEYS[1]) " +
                    "else return 0 end",
            Long.class
    );

    private final StringRedisTemplate stringRedisTemplate;
    private final TrainingProperties trainingProperties;

    private final ReentrantLock localLock = new ReentrantLock();
    /** 只在持有 localLock 时读写 */
    private String redisToken;

    /**
     * @return true 表示获取成功，调用方必须在 finally 中调用 {@link #release()}
     */
    public boolean tryAcquire() {
        if (!localLock.tryLock()) {
            return false;
        }
        if (!trainingProperties.isDistributedLock()) {
            return true;
        }
        String token = UUID.randomUUID().toString();
        try {
            Boolean success = stringRedisTemplate.opsForValue().setIfAbsent(
                    RedisConstants.LOCK_TRAINING_KEY, token, trainingProperties.getLockLeaseSeconds(), TimeUnit.SECONDS);
            if (Boolean.TRUE.equals(success)) {
                redisToken = token;
                return true;
            }
            log.info("训练锁已被其他实例持有: key={}", RedisConstants.LOCK_TRAINING_KEY);
        } catch (Exception e) {
            log.warn("获取训练分布式锁失败，本次跳过: key={}", RedisConstants.LOCK_TRAINING_KEY, e);
        }
        localLock.unlock();
        return false;
    }

    public void release() {
        if (!localLock.isHeldByCurrentThread()) {
            return;
        }
        try {
            if (redisToken != null) {
                stringRedisTemplate.execute(UNLOCK_SCRIPT,
                        Collections.singletonList(RedisConstants.LOCK_TRAINING_KEY), redisToken);
            }
        } catch (Exception e) {
            // 解锁失败时租约到期自动释放，不影响训练结果
            log.warn("释放训练分布式锁失败: key={}", RedisConstants.LOCK_TRAINING_KEY, e);
        } finally {
            redisToken = null;
            localLock.unlock();
        }
    }
}
