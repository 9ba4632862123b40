package com.thorbis.security.policy;

import com.thorbis.security.tenant.Industry;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled, immutable policy for one industry at one version.
 * <p>
 * Roles are numbered 0..n-1; {@code parents[i]} lists the roles role {@code i} inherits from and
 * {@code grantsByRole[i]} its own grants keyed by (resource type, action). The topological order
 * is computed once by {@link PolicyCompiler}.
 * <p>
 * Effective permissions are memoised per role combination. The cache lives on this object, so a
 * reload that installs a new snapshot starts from an empty cache.
 */
public final class IndustryPolicy {

    private final Industry industry;
    private final String version;
    private final String[] roleNames;
    private final Map<String, Integer> roleIds;
    private final int[][] parents;
    private final int[] topologicalOrder;
    private final List<Map<ResourceAction, List<Grant>>> grantsByRole;
    private final List<CrossTenantGrant> crossTenantGrants;
    private final Map<String, Duration> sessionIdleTimeouts;
    private final Map<String, EffectivePermissions> memo = new ConcurrentHashMap<>();

    IndustryPolicy(Industry industry, String version, String[] roleNames, int[][] parents,
                   int[] topologicalOrder, List<Map<ResourceAction, List<Grant>>> grantsByRole,
                   List<CrossTenantGrant> crossTenantGrants, Map<String, Duration> sessionIdleTimeouts) {
        this.industry = industry;
        this.version = version;
        this.roleNames = roleNames.clone();
        Map<String, Integer> ids = new HashMap<>();
        for (int i = 0; i < roleNames.length; i++) {
            ids.put(roleNames[i], i);
        }
        this.roleIds = Map.copyOf(ids);
        this.parents = parents;
        this.topologicalOrder = topologicalOrder;
        this.grantsByRole = grantsByRole;
        this.crossTenantGrants = List.copyOf(crossTenantGrants);
        this.sessionIdleTimeouts = Map.copyOf(sessionIdleTimeouts);
    }

    public Industry industry() {
        return industry;
    }

    public String version() {
        return version;
    }

    public boolean hasRole(String role) {
        return role != null && roleIds.containsKey(role);
    }

    /** Role names ordered so that every role appears before the roles it inherits from. */
    public List<String> topologicalOrder() {
        List<String> names = new ArrayList<>(topologicalOrder.length);
        for (int id : topologicalOrder) {
            names.add(roleNames[id]);
        }
        return names;
    }

    public List<CrossTenantGrant> crossTenantGrants() {
        return crossTenantGrants;
    }

    /** Idle timeout configured for a role, if any. */
    public Optional<Duration> idleTimeoutFor(String role) {
        return Optional.ofNullable(role == null ? null : sessionIdleTimeouts.get(role));
    }

    /**
     * Computes what a binding may do.
     * <p>
     * Breadth-first over the inheritance graph starting at the industry role (distance 0) and the
     * base role (distance 1 when an industry role is present, 0 otherwise). For each pair, grants
     * of the nearest contributing role win. If several roles contribute at that distance with
     * different constraints, the permission is conflicted.
     *
     * @throws IllegalArgumentException if a role is not declared in this policy
     */
    public EffectivePermissions effectivePermissions(String baseRole, String industryRole) {
        String key = baseRole + "|" + (industryRole == null ? "" : industryRole);
        return memo.computeIfAbsent(key, k -> compute(baseRole, industryRole));
    }

    private EffectivePermissions compute(String baseRole, String industryRole) {
        int[] distance = new int[roleNames.length];
        Arrays.fill(distance, -1);
        Deque<Integer> queue = new ArrayDeque<>();
        if (industryRole != null) {
            enqueue(requireRole(industryRole), 0, distance, queue);
            enqueue(requireRole(baseRole), 1, distance, queue);
        } else {
            enqueue(requireRole(baseRole), 0, distance, queue);
        }

        List<Integer> visited = new ArrayList<>();
        while (!queue.isEmpty()) {
            int role = queue.poll();
            visited.add(role);
            for (int parent : parents[role]) {
                enqueue(parent, distance[role] + 1, distance, queue);
            }
        }

        // pair -> contributing role -> grants, only at the nearest distance
        Map<ResourceAction, Integer> nearest = new HashMap<>();
        Map<ResourceAction, Map<Integer, List<Grant>>> contributors = new LinkedHashMap<>();
        for (int role : visited) {
            for (Map.Entry<ResourceAction, List<Grant>> entry : grantsByRole.get(role).entrySet()) {
                ResourceAction pair = entry.getKey();
                Integer best = nearest.get(pair);
                if (best == null || distance[role] < best) {
                    nearest.put(pair, distance[role]);
                    Map<Integer, List<Grant>> byRole = new LinkedHashMap<>();
                    byRole.put(role, entry.getValue());
                    contributors.put(pair, byRole);
                } else if (distance[role] == best) {
                    contributors.get(pair).put(role, entry.getValue());
                }
            }
        }

        Map<ResourceAction, EffectivePermission> result = new HashMap<>();
        for (Map.Entry<ResourceAction, Map<Integer, List<Grant>>> entry : contributors.entrySet()) {
            ResourceAction pair = entry.getKey();
            List<List<Grant>> sets = new ArrayList<>(entry.getValue().values());
            boolean conflicted = false;
            for (List<Grant> other : sets.subList(1, sets.size())) {
                if (!sameConstraints(sets.get(0), other)) {
                    conflicted = true;
                    break;
                }
            }
            result.put(pair, new EffectivePermission(pair, sets.get(0), nearest.get(pair), conflicted));
        }
        return new EffectivePermissions(version, result);
    }

    private static void enqueue(int role, int dist, int[] distance, Deque<Integer> queue) {
        if (distance[role] == -1) {
            distance[role] = dist;
            queue.add(role);
        }
    }

    private int requireRole(String role) {
        Integer id = roleIds.get(role);
        if (id == null) {
            throw new IllegalArgumentException(
                    "Role '" + role + "' is not defined in " + industry.value() + " policy " + version);
        }
        return id;
    }

    private static boolean sameConstraints(List<Grant> a, List<Grant> b) {
        if (a.size() != b.size()) {
            return false;
        }
        List<List<GrantConstraint>> left = new ArrayList<>();
        List<List<GrantConstraint>> right = new ArrayList<>();
        a.forEach(g -> left.add(g.constraints()));
        b.forEach(g -> right.add(g.constraints()));
        return left.containsAll(right) && right.containsAll(left);
    }
}
