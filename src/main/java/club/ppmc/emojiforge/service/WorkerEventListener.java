package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.protocol.WorkerEvent;

/**
 * 后端事件的订阅者。回调总是在 WorkerEventDispatcher 的投递线程上执行。
 */
@FunctionalInterface
public interface WorkerEventListener {

    void onEvent(WorkerEvent event);
}
