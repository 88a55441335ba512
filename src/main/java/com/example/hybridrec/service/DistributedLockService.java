package com.example.hybridrec.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 分布式锁服务
 *
 * 功能：
 * 1. 同一用户的偏好学习同一时刻只在一个节点执行
 * 2. NCF 离线训练全局互斥
 * 3. 自动过期防死锁（TTL 机制）
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    private final RedissonClient redissonClient;

    // 锁自动释放时间（秒，防死锁）
    private static final long LEASE_TIME = 600;

    /**
     * 尝试获取锁，不等待
     *
     * @param name 业务锁名，如 preference:{userId}
     * @return 是否成功获取锁
     */
    public boolean tryLock(String name) {
        RLock lock = redissonClient.getLock(getLockKey(name));

        try {
            boolean acquired = lock.tryLock(0, LEASE_TIME, TimeUnit.SECONDS);

            if (acquired) {
                log.debug("[Lock] 获取锁成功: name={}", name);
            } else {
                log.info("[Lock] 锁已被占用，跳过: name={}", name);
            }

            return acquired;
        } catch (InterruptedException e) {
            log.error("[Lock] 获取锁时被中断: name={}", name, e);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void unlock(String name) {
        RLock lock = redissonClient.getLock(getLockKey(name));

        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("[Lock] 释放锁: name={}", name);
        } else {
            log.warn("[Lock] 尝试释放非本线程持有的锁: name={}", name);
        }
    }

    /**
     * 执行带锁的操作（带返回值），获取锁失败返回 defaultValue
     */
    public <T> T executeWithLock(String name, Supplier<T> action, T defaultValue) {
        if (tryLock(name)) {
            try {
                return action.get();
            } finally {
                unlock(name);
            }
        }
        return defaultValue;
    }

    private String getLockKey(String name) {
        return "rec:lock:" + name;
    }
}
