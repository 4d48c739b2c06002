package org.tacheck;

import org.tacheck.automata.models.SystemModel;
import org.tacheck.io.ModelLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * 测试用模型，位于 src/test/resources/models。
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static SystemModel load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/models/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("找不到测试模型 " + name);
            }
            return new ModelLoader().load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
