package tech.syncbridge.platform.worker;

@FunctionalInterface
public interface WorkHandler {

    void handle(WorkItem item);
}
