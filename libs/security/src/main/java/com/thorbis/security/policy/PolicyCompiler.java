package com.thorbis.security.policy;

import com.thorbis.security.tenant.Industry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates policy documents and compiles them into a {@link PolicySnapshot}.
 * <p>
 * Validation collects every problem across all documents before failing, so an administrator sees
 * the full list in one reload attempt. Checks: known industry, matching version, one document per
 * industry, unique role names, declared parents, acyclic inheritance, grants referencing declared
 * roles and (resource type, action) pairs, unique rule ids, well-formed constraints and positive
 * idle timeouts.
 */
public final class PolicyCompiler {

    private PolicyCompiler() {
        // utility class
    }

    /**
     * @throws RoleCycleException        if any role graph has a cycle
     * @throws PolicyValidationException for any other problem
     */
    public static PolicySnapshot compile(String version, Collection<PolicyDocument> documents, Clock clock) {
        List<String> diagnostics = new ArrayList<>();
        List<String> firstCycle = null;
        Map<Industry, IndustryPolicy> compiled = new EnumMap<>(Industry.class);

        if (documents.isEmpty()) {
            diagnostics.add("policy version " + version + " contains no documents");
        }
        for (PolicyDocument document : documents) {
            String label = document.industry() + "@" + document.version();
            Optional<Industry> industry = Industry.fromString(document.industry());
            if (industry.isEmpty()) {
                diagnostics.add(label + ": unknown industry '" + document.industry() + "'");
                continue;
            }
            if (!version.equals(document.version())) {
                diagnostics.add(label + ": document version does not match requested version " + version);
            }
            if (compiled.containsKey(industry.get())) {
                diagnostics.add(label + ": duplicate document for industry");
                continue;
            }
            List<String> local = new ArrayList<>();
            List<String> cycle = new ArrayList<>();
            IndustryPolicy policy = compileDocument(industry.get(), version, document, local, cycle);
            local.forEach(d -> diagnostics.add(label + ": " + d));
            if (!cycle.isEmpty() && firstCycle == null) {
                firstCycle = cycle;
            }
            if (policy != null) {
                compiled.put(industry.get(), policy);
            }
        }

        if (firstCycle != null) {
            throw new RoleCycleException(firstCycle, diagnostics);
        }
        if (!diagnostics.isEmpty()) {
            throw new PolicyValidationException(diagnostics);
        }
        return new PolicySnapshot(version, compiled, clock.instant());
    }

    private static IndustryPolicy compileDocument(Industry industry, String version, PolicyDocument document,
                                                  List<String> diagnostics, List<String> cycleOut) {
        // roles -> ids
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (RoleDefinition role : document.roles()) {
            if (role.name() == null || role.name().isBlank()) {
                diagnostics.add("role with blank name");
            } else if (ids.putIfAbsent(role.name(), ids.size()) != null) {
                diagnostics.add("duplicate role '" + role.name() + "'");
            }
        }
        String[] names = ids.keySet().toArray(new String[0]);
        int[][] parents = new int[names.length][];
        for (RoleDefinition role : document.roles()) {
            Integer id = ids.get(role.name());
            if (id == null || parents[id] != null) {
                continue;
            }
            List<Integer> resolved = new ArrayList<>();
            for (String parent : role.inherits()) {
                Integer parentId = ids.get(parent);
                if (parentId == null) {
                    diagnostics.add("role '" + role.name() + "' inherits undeclared role '" + parent + "'");
                } else if (!resolved.contains(parentId)) {
                    resolved.add(parentId);
                }
            }
            parents[id] = resolved.stream().mapToInt(Integer::intValue).toArray();
        }

        List<String> cycle = findCycle(names, parents);
        if (!cycle.isEmpty()) {
            diagnostics.add(RoleCycleException.describe(cycle));
            cycleOut.addAll(cycle);
        }

        Set<ResourceAction> declared = new HashSet<>();
        for (ResourceAction pair : document.resourceActions()) {
            if (isBlank(pair.resourceType()) || isBlank(pair.action())) {
                diagnostics.add("resource action with blank resourceType or action");
            } else if (!declared.add(pair)) {
                diagnostics.add("duplicate resource action " + pair);
            }
        }

        Set<String> ruleIds = new HashSet<>();
        List<Map<ResourceAction, List<Grant>>> grantsByRole = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            grantsByRole.add(new HashMap<>());
        }
        for (Grant grant : document.grants()) {
            String rule = grant.ruleId();
            checkRuleId(rule, ruleIds, diagnostics);
            Integer roleId = ids.get(grant.role());
            if (roleId == null) {
                diagnostics.add("grant " + rule + " references undeclared role '" + grant.role() + "'");
            }
            if (!declared.contains(grant.resourceAction())) {
                diagnostics.add("grant " + rule + " references undeclared resource action "
                        + grant.resourceAction());
            }
            checkConstraints("grant " + rule, grant.constraints(), diagnostics);
            if (roleId != null) {
                grantsByRole.get(roleId)
                        .computeIfAbsent(grant.resourceAction(), k -> new ArrayList<>())
                        .add(grant);
            }
        }

        for (CrossTenantGrant grant : document.crossTenantGrants()) {
            String rule = grant.ruleId();
            checkRuleId(rule, ruleIds, diagnostics);
            if (isBlank(grant.principalId())) {
                diagnostics.add("cross-tenant grant " + rule + " has no principalId");
            }
            if (grant.tenantIds().isEmpty()) {
                diagnostics.add("cross-tenant grant " + rule + " lists no tenants");
            }
            if (!declared.contains(grant.resourceAction())) {
                diagnostics.add("cross-tenant grant " + rule + " references undeclared resource action "
                        + grant.resourceAction());
            }
            checkConstraints("cross-tenant grant " + rule, grant.constraints(), diagnostics);
        }

        for (Map.Entry<String, Duration> timeout : document.sessionIdleTimeouts().entrySet()) {
            if (!ids.containsKey(timeout.getKey())) {
                diagnostics.add("idle timeout for undeclared role '" + timeout.getKey() + "'");
            }
            if (timeout.getValue() == null || timeout.getValue().isZero() || timeout.getValue().isNegative()) {
                diagnostics.add("idle timeout for role '" + timeout.getKey() + "' must be positive");
            }
        }

        if (!diagnostics.isEmpty()) {
            return null;
        }
        List<Map<ResourceAction, List<Grant>>> frozen = new ArrayList<>();
        for (Map<ResourceAction, List<Grant>> byPair : grantsByRole) {
            Map<ResourceAction, List<Grant>> copy = new HashMap<>();
            byPair.forEach((pair, grants) -> copy.put(pair, List.copyOf(grants)));
            frozen.add(Map.copyOf(copy));
        }
        return new IndustryPolicy(industry, version, names, parents, topologicalOrder(parents),
                List.copyOf(frozen), document.crossTenantGrants(), document.sessionIdleTimeouts());
    }

    /**
     * Depth-first search with an explicit path. Returns the first cycle found as role names with
     * the starting role repeated at the end, or an empty list.
     */
    static List<String> findCycle(String[] names, int[][] parents) {
        int[] state = new int[names.length]; // 0 unvisited, 1 on path, 2 done
        for (int start = 0; start < names.length; start++) {
            if (state[start] != 0) {
                continue;
            }
            Deque<int[]> stack = new ArrayDeque<>(); // {role, next parent index}
            List<Integer> path = new ArrayList<>();
            stack.push(new int[]{start, 0});
            state[start] = 1;
            path.add(start);
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int role = frame[0];
                int[] next = parents[role] == null ? new int[0] : parents[role];
                if (frame[1] < next.length) {
                    int parent = next[frame[1]++];
                    if (state[parent] == 1) {
                        List<String> cycle = new ArrayList<>();
                        for (int i = path.indexOf(parent); i < path.size(); i++) {
                            cycle.add(names[path.get(i)]);
                        }
                        cycle.add(names[parent]);
                        return cycle;
                    }
                    if (state[parent] == 0) {
                        state[parent] = 1;
                        path.add(parent);
                        stack.push(new int[]{parent, 0});
                    }
                } else {
                    state[role] = 2;
                    path.remove(path.size() - 1);
                    stack.pop();
                }
            }
        }
        return List.of();
    }

    /** Kahn's algorithm: children before the parents they inherit from. Graph must be acyclic. */
    static int[] topologicalOrder(int[][] parents) {
        int n = parents.length;
        int[] inDegree = new int[n];
        for (int[] ps : parents) {
            for (int p : ps) {
                inDegree[p]++;
            }
        }
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        int[] order = new int[n];
        int index = 0;
        while (!ready.isEmpty()) {
            int role = ready.poll();
            order[index++] = role;
            for (int p : parents[role]) {
                if (--inDegree[p] == 0) {
                    ready.add(p);
                }
            }
        }
        return order;
    }

    private static void checkRuleId(String ruleId, Set<String> seen, List<String> diagnostics) {
        if (isBlank(ruleId)) {
            diagnostics.add("grant with blank ruleId");
        } else if (!seen.add(ruleId)) {
            diagnostics.add("duplicate ruleId '" + ruleId + "'");
        }
    }

    private static void checkConstraints(String owner, List<GrantConstraint> constraints,
                                         List<String> diagnostics) {
        for (GrantConstraint constraint : constraints) {
            if (constraint == null) {
                diagnostics.add(owner + " has a null constraint");
                continue;
            }
            constraint.validate().forEach(problem -> diagnostics.add(owner + ": " + problem));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
