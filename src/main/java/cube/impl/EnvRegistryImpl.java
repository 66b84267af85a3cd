package cube.impl;

import cube.contracts.EnvRegistry;
import cube.records.CubeEnv;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thread-safe, insertion-ordered {@link EnvRegistry}.
 */
public final class EnvRegistryImpl implements EnvRegistry {

    private final Map<String, CubeEnv> envs = new LinkedHashMap<>();

    @Override
    public synchronized void register(CubeEnv env) {
        Objects.requireNonNull(env, "env");
        if (envs.containsKey(env.name())) {
            throw new IllegalStateException("Environment already registered: " + env.name());
        }
        envs.put(env.name(), env);
    }

    @Override
    public synchronized CubeEnv get(String name) {
        CubeEnv env = envs.get(name);
        if (env == null) {
            throw new IllegalArgumentException("Unknown environment '" + name + "', known: " + envs.keySet());
        }
        return env;
    }

    @Override
    public synchronized boolean contains(String name) {
        return envs.containsKey(name);
    }

    @Override
    public synchronized Collection<CubeEnv> all() {
        return Collections.unmodifiableCollection(new ArrayList<>(envs.values()));
    }
}
