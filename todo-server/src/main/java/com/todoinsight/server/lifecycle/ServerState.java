package com.todoinsight.server.lifecycle;

/**
 * 服务生命周期状态：STARTING → LISTENING → DRAINING → STOPPED。
 */
public enum ServerState {
    /** 正在初始化持久化模块，尚未监听端口。 */
    STARTING,
    /** Web 服务器已绑定端口，正在处理请求。 */
    LISTENING,
    /** 收到终止信号，正在释放持久化资源。 */
    DRAINING,
    /** 资源释放结束（无论成功与否），进程即将退出。 */
    STOPPED
}
