package cube.contracts;

import cube.records.CubeEnv;
import java.util.Collection;

/**
 * Name-keyed lookup of puzzle environments for an external search or training harness.
 */
public interface EnvRegistry {

    /** @throws IllegalStateException if the name is already taken */
    void register(CubeEnv env);

    /** @throws IllegalArgumentException for unknown names */
    CubeEnv get(String name);

    boolean contains(String name);

    /** Registered environments in registration order. */
    Collection<CubeEnv> all();
}
