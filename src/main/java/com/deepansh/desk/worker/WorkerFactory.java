package com.deepansh.desk.worker;

@FunctionalInterface
public interface WorkerFactory {

    Worker create(WorkerState state, WorkerServices services);
}
