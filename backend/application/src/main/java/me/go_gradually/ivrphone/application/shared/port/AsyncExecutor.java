package me.go_gradually.ivrphone.application.shared.port;

@FunctionalInterface
public interface AsyncExecutor {
    void execute(Runnable task);
}
