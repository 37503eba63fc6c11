package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.exception.RetryableResolutionFailure;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 实体创建/合并的短时咨询锁
 *
 * 按键哈希分段的公平锁；多键加锁按分段序号升序获取，避免死锁
 */
@Component
public class EntityLockRegistry {

    private static final int STRIPES = 256;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public EntityLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock(true);
        }
    }

    public <T> T withLock(String key, long timeoutMs, Supplier<T> action) {
        return withLocks(List.of(key), timeoutMs, action);
    }

    public <T> T withLocks(Collection<String> keys, long timeoutMs, Supplier<T> action) {
        TreeSet<Integer> stripes = new TreeSet<>();
        for (String key : keys) {
            if (key != null) {
                stripes.add(Math.floorMod(key.hashCode(), STRIPES));
            }
        }

        int acquired = 0;
        Integer[] order = stripes.toArray(new Integer[0]);
        try {
            for (Integer stripe : order) {
                if (!locks[stripe].tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                    throw new RetryableResolutionFailure("等待实体锁超时: " + keys);
                }
                acquired++;
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableResolutionFailure("等待实体锁被中断: " + keys, e);
        } finally {
            for (int i = acquired - 1; i >= 0; i--) {
                locks[order[i]].unlock();
            }
        }
    }
}
