package com.flowpulse.trigger.application.common;

/**
 * 重试间隔等待。生产环境为线程休眠，测试注入记录型实现。
 */
@FunctionalInterface
public interface RetrySleeper {

    RetrySleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
