package com.stepwise.core.graph;

import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates and links TDD phase chains (failing test, make it pass, clean up).
 * <p>
 * Walks tasks in list order. Explicit predecessor references are checked; missing
 * ones on MakePass and Cleanup tasks are inferred as the nearest preceding open
 * chain, narrowed to the task's domain first. A chain passed over that way that is
 * claimed later means the chains interleave: the inferring task is then reported
 * and an explicit reference is required. Task order is never changed.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /** A failing test and the tasks that closed it so far. */
    private static final class Chain {
        final Task failingTest;
        Task makePass;
        Task cleanup;

        Chain(Task failingTest) {
            this.failingTest = failingTest;
        }
    }

    /** An inference that picked the nearest of several open chains. */
    private record Inference(Task task, TddPhase role, List<Chain> passedOver, List<String> openIds) {
    }

    /**
     * Resolves predecessor references.
     *
     * @param tasks parsed tasks in list order
     * @return the same tasks, in the same order, with every MakePass and Cleanup linked
     * @throws DependencyException listing every broken chain
     */
    public List<Task> resolve(List<Task> tasks) {
        Set<String> allIds = tasks.stream().map(Task::id).collect(Collectors.toSet());
        Map<String, Task> seen = new HashMap<>();
        Map<String, Chain> chainByTask = new HashMap<>();
        List<Chain> chains = new ArrayList<>();
        List<DependencyException.Problem> problems = new ArrayList<>();
        List<Task> resolved = new ArrayList<>(tasks.size());
        Map<String, Integer> position = new HashMap<>();
        List<Inference> inferences = new ArrayList<>();
        Set<String> interleaved = new LinkedHashSet<>();

        for (var task : tasks) {
            position.put(task.id(), position.size());
            Task result = task;
            String ref = task.predecessorRef();

            if (ref != null && !seen.containsKey(ref)) {
                String why = ref.equals(task.id()) ? "references itself"
                        : allIds.contains(ref) ? "references later task " + ref
                        : "references unknown task " + ref;
                problems.add(new DependencyException.Problem(task.id(), why));
                resolved.add(task);
                seen.put(task.id(), task);
                continue;
            }

            switch (task.phase()) {
                case FAILING_TEST -> {
                    var chain = new Chain(task);
                    chains.add(chain);
                    chainByTask.put(task.id(), chain);
                }
                case MAKE_PASS -> {
                    Chain chain = ref != null
                            ? explicitChain(task, seen.get(ref), TddPhase.FAILING_TEST, chainByTask, problems)
                            : inferChain(task, chains.stream()
                                    .filter(c -> c.makePass == null).toList(), c -> c.failingTest,
                                    position, inferences, problems,
                                    "no open FailingTest precedes this MakePass");
                    if (chain != null) {
                        if (chain.makePass != null) {
                            problems.add(new DependencyException.Problem(task.id(),
                                    "FailingTest %s is already made to pass by %s"
                                            .formatted(chain.failingTest.id(), chain.makePass.id())));
                        } else {
                            chain.makePass = task;
                            checkPassedOver(chain, TddPhase.MAKE_PASS, inferences, interleaved);
                            chainByTask.put(task.id(), chain);
                            result = task.withPredecessor(chain.failingTest.id());
                        }
                    }
                }
                case CLEANUP -> {
                    Chain chain = ref != null
                            ? explicitChain(task, seen.get(ref), TddPhase.MAKE_PASS, chainByTask, problems)
                            : inferChain(task, chains.stream()
                                    .filter(c -> c.makePass != null && c.cleanup == null).toList(),
                                    c -> c.makePass, position, inferences, problems,
                                    "no open MakePass precedes this Cleanup");
                    if (chain != null) {
                        if (chain.cleanup == null) {
                            chain.cleanup = task;
                            checkPassedOver(chain, TddPhase.CLEANUP, inferences, interleaved);
                        }
                        chainByTask.put(task.id(), chain);
                        result = task.withPredecessor(chain.makePass.id());
                    }
                }
                case NONE -> {
                    // plain dependency, already checked to point backwards
                }
            }

            seen.put(task.id(), result);
            resolved.add(result);
        }

        for (var inference : inferences) {
            if (interleaved.contains(inference.task().id())) {
                problems.add(new DependencyException.Problem(inference.task().id(),
                        "ambiguous predecessor, interleaved open chains " + inference.openIds()
                                + "; add an explicit reference"));
            }
        }
        problems.sort(Comparator.comparing(p -> position.getOrDefault(p.taskId(), Integer.MAX_VALUE)));

        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("Dependency problem {}", p));
            throw new DependencyException(problems);
        }
        log.info("Resolved {} tasks into {} TDD chains", resolved.size(), chains.size());
        return resolved;
    }

    private Chain explicitChain(Task task, Task target, TddPhase expected,
                                Map<String, Chain> chainByTask, List<DependencyException.Problem> problems) {
        if (target.phase() != expected) {
            problems.add(new DependencyException.Problem(task.id(),
                    "%s must reference a %s task, but %s is %s"
                            .formatted(task.phase(), expected, target.id(), target.phase())));
            return null;
        }
        return chainByTask.get(target.id());
    }

    private Chain inferChain(Task task, List<Chain> candidates,
                             Function<Chain, Task> anchor, Map<String, Integer> position,
                             List<Inference> inferences,
                             List<DependencyException.Problem> problems, String noneMessage) {
        if (candidates.isEmpty()) {
            problems.add(new DependencyException.Problem(task.id(), noneMessage));
            return null;
        }
        if (candidates.size() == 1) {
            log.debug("  {} inferred predecessor {}", task.id(), anchor.apply(candidates.get(0)).id());
            return candidates.get(0);
        }

        DomainTag domain = task.domain();
        var sameDomain = candidates.stream().filter(c -> anchor.apply(c).domain() == domain).toList();
        var pool = sameDomain.isEmpty() ? candidates : sameDomain;
        Chain nearest = pool.stream()
                .max(Comparator.comparing(c -> position.get(anchor.apply(c).id())))
                .orElseThrow();
        if (pool.size() > 1) {
            var passedOver = pool.stream().filter(c -> c != nearest).toList();
            var openIds = pool.stream().map(c -> anchor.apply(c).id()).sorted().toList();
            inferences.add(new Inference(task, task.phase(), passedOver, openIds));
        }
        log.debug("  {} inferred nearest predecessor {} (domain {})", task.id(),
                anchor.apply(nearest).id(), domain);
        return nearest;
    }

    /** Marks inferences whose passed-over chain is now claimed by a later task of the same phase. */
    private void checkPassedOver(Chain claimed, TddPhase role, List<Inference> inferences, Set<String> interleaved) {
        for (var inference : inferences) {
            if (inference.role() == role && inference.passedOver().contains(claimed)) {
                interleaved.add(inference.task().id());
            }
        }
    }
}
