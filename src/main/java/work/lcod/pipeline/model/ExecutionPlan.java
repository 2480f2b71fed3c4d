package work.lcod.pipeline.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered invocations, fixed before execution starts.
 */
public final class ExecutionPlan implements Iterable<FunctionInvocation> {
    private final List<FunctionInvocation> invocations;

    private ExecutionPlan(List<FunctionInvocation> invocations) {
        this.invocations = List.copyOf(invocations);
    }

    /**
     * Builds a plan, renumbering the invocations so sequence equals plan position.
     */
    public static ExecutionPlan of(List<FunctionInvocation> ordered) {
        var numbered = new ArrayList<FunctionInvocation>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            numbered.add(ordered.get(i).withSequence(i));
        }
        return new ExecutionPlan(numbered);
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of());
    }

    public List<FunctionInvocation> invocations() {
        return invocations;
    }

    public int size() {
        return invocations.size();
    }

    public boolean isEmpty() {
        return invocations.isEmpty();
    }

    @Override
    public Iterator<FunctionInvocation> iterator() {
        return invocations.iterator();
    }

    public List<Map<String, Object>> describe() {
        var rows = new ArrayList<Map<String, Object>>();
        for (var invocation : invocations) {
            var row = new LinkedHashMap<String, Object>();
            row.put("sequence", invocation.sequence());
            row.put("name", invocation.name());
            row.put("runtime", invocation.declaration().runtime().kind().key());
            row.put("anchor", invocation.anchor());
            row.put("deferFailure", invocation.declaration().deferFailure());
            row.put("origin", invocation.origin().name().toLowerCase(Locale.ROOT));
            rows.add(row);
        }
        return rows;
    }
}
