package com.example.scan2doc.util.common;

import com.example.scan2doc.exception.GenerationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 任务取消标记
 *
 * 由请求线程置位，生成线程在每个阶段开始前检查。
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 已取消时抛出异常，中止后续阶段
     *
     * @param stage 即将开始的阶段
     */
    public void checkpoint(String stage) throws GenerationCancelledException {
        if (cancelled.get()) {
            throw new GenerationCancelledException(stage);
        }
    }
}
