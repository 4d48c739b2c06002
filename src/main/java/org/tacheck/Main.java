package org.tacheck;

import org.tacheck.automata.models.SystemModel;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.exceptions.ModelException;
import org.tacheck.io.ModelLoader;
import org.tacheck.io.ModelWriter;
import org.tacheck.query.QueryDispatcher;
import org.tacheck.query.QueryResult;
import org.tacheck.service.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口：tacheck &lt;model.json&gt; "&lt;q1&gt;; &lt;q2&gt;" [-o saved.json]
 * <p>
 * 依次打印每个查询的结果。有查询不成立或被拒绝时退出码为 1，模型无法加载时为 2。
 * 引擎参数通过 tacheck.* 系统属性设置，见 {@link EngineConfig#fromSystemProperties()}。
 */
public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_QUERY_FAILED = 1;
    static final int EXIT_MODEL_ERROR = 2;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Path modelPath = null;
        String queries = null;
        Path outputPath = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-o" -> {
                    if (i + 1 >= args.length) {
                        usage();
                        return EXIT_MODEL_ERROR;
                    }
                    outputPath = Paths.get(args[++i]);
                }
                case "-h", "--help" -> {
                    usage();
                    return EXIT_OK;
                }
                default -> {
                    if (modelPath == null) {
                        modelPath = Paths.get(args[i]);
                    } else if (queries == null) {
                        queries = args[i];
                    } else {
                        usage();
                        return EXIT_MODEL_ERROR;
                    }
                }
            }
        }
        if (modelPath == null || queries == null) {
            usage();
            return EXIT_MODEL_ERROR;
        }

        SystemModel model;
        try {
            model = new ModelLoader().load(modelPath);
        } catch (IOException | ModelException e) {
            logger.error("无法加载模型 {}: {}", modelPath, e.getMessage());
            System.err.println("Cannot load model " + modelPath + ": " + e.getMessage());
            return EXIT_MODEL_ERROR;
        }

        List<QueryResult> results = new QueryDispatcher(EngineConfig.fromSystemProperties()).evaluate(model, queries);
        boolean allSucceeded = true;
        List<TimedAutomaton> saved = new ArrayList<>();
        for (QueryResult result : results) {
            System.out.println(result);
            allSucceeded &= result.getStatus() != QueryResult.Status.FAILURE
                    && result.getStatus() != QueryResult.Status.REJECTED;
            result.getSavedComponent().ifPresent(saved::add);
        }

        if (outputPath != null && !saved.isEmpty()) {
            try {
                new ModelWriter().write(saved, outputPath);
            } catch (IOException e) {
                logger.error("无法写出组件到 {}: {}", outputPath, e.getMessage());
                System.err.println("Cannot write " + outputPath + ": " + e.getMessage());
                return EXIT_QUERY_FAILED;
            }
        }
        return allSucceeded ? EXIT_OK : EXIT_QUERY_FAILED;
    }

    private static void usage() {
        System.err.println("Usage: tacheck <model.json> \"<query>; <query>; ...\" [-o saved-components.json]");
    }
}
