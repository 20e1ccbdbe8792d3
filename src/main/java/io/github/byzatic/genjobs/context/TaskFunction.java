package io.github.byzatic.genjobs.context;

import java.util.List;

/**
 * The unit of work. Returns one output per slot the task declares, in declaration order.
 * May throw; a failure is confined to the task that raised it.
 */
@FunctionalInterface
public interface TaskFunction<I, O> {
    List<O> apply(I input) throws Exception;
}
