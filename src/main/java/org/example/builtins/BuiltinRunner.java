package org.example.builtins;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Evaluates a batch of builtin calls described in JSON and writes their results.
 *
 * <pre>
 * { "calls": [
 *     { "target": "firstA", "function": "search", "args": ["a", "abcdabcd"] },
 *     { "target": "mid",    "function": "lookup", "args": [5, [[0, 0], [10, 100]]] }
 * ] }
 * </pre>
 * produces
 * <pre>
 * { "results":  { "firstA": [0], "mid": 50 },
 *   "warnings": { } }
 * </pre>
 */
public class BuiltinRunner {

    // =========================================================
    // Configuration
    // =========================================================
    static final String INPUT_DIR = "input";
    static final String OUTPUT_DIR = "output";
    static final String INPUT_FILE = "calls.json";
    static final String OUTPUT_FILE = "results.json";

    // =========================================================
    // Entry
    // =========================================================
    /**
     * {@code BuiltinRunner [input.json [output.json]]}; without arguments the
     * input is looked up on the classpath, then under {@code input/}.
     */
    public static void main(String[] args) {
        try {
            FunctionRegistry registry = new FunctionRegistry();
            StandardFunctions.registerAll(registry);

            ObjectNode input = args.length > 0 ? JsonFiles.load(Paths.get(args[0])) : JsonFiles.loadInputJson();
            System.out.println("Loaded " + (args.length > 0 ? args[0] : INPUT_FILE));

            ObjectNode output = run(input, registry, new RandomSource(), WarningSink.STDERR);

            Path target = args.length > 1
                    ? Paths.get(args[1])
                    : JsonFiles.resolveOutputDir(OUTPUT_DIR).resolve(OUTPUT_FILE);
            JsonFiles.save(output, target);
            System.out.println("\n=== Saved " + target + " ===");

        } catch (EvalException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace();
            System.exit(3);
        }
    }

    /**
     * Evaluates every entry of {@code input.calls} in order. Each call gets its
     * own warning list in the output; the same warnings are passed on to
     * {@code echo}, prefixed with the call's target.
     */
    static ObjectNode run(ObjectNode input, FunctionRegistry registry, RandomSource random, WarningSink echo) {
        JsonNode calls = input.get("calls");
        if (calls == null || !calls.isArray()) {
            throw new EvalException("PARSE_ERROR: input must contain a 'calls' array");
        }

        ObjectNode output = ValueJson.MAPPER.createObjectNode();
        ObjectNode results = output.putObject("results");
        ObjectNode warnings = output.putObject("warnings");

        int index = 0;
        for (JsonNode call : calls) {
            index++;
            String target = call.hasNonNull("target") ? call.get("target").asText() : "call_" + index;
            if (!call.hasNonNull("function")) {
                throw new EvalException("PARSE_ERROR: call '" + target + "' has no 'function'");
            }
            String function = call.get("function").asText();
            List<Value> args = ValueJson.toValues(call.get("args"));

            System.out.println("  Target: " + target);
            System.out.println("  Call: " + function + ValuePrinter.print(new VecVal(args)));

            CollectingWarningSink sink = new CollectingWarningSink();
            Value result = registry.call(new Context(sink, random), function, args);

            System.out.println("  Result: " + ValuePrinter.print(result));
            results.set(target, ValueJson.toJson(result));
            if (!sink.isEmpty()) {
                ArrayNode list = warnings.putArray(target);
                for (String message : sink.messages()) {
                    list.add(message);
                    echo.warn(target + ": " + message);
                }
            }
        }
        return output;
    }

    // =========================================================
    // JSON files
    // =========================================================
    static final class JsonFiles {

        /**
         * Load calls.json from the classpath ({@code /input/calls.json}) or the
         * file system ({@code input/} or {@code src/main/resources/input/}).
         */
        static ObjectNode loadInputJson() {
            String resource = "/" + INPUT_DIR + "/" + INPUT_FILE;
            try (InputStream in = BuiltinRunner.class.getResourceAsStream(resource)) {
                if (in != null) return asObject(ValueJson.MAPPER.readTree(in), resource);
            } catch (IOException e) {
                throw new EvalException("PARSE_ERROR: cannot read " + resource + " - " + e.getMessage(), e);
            }

            String[] fsPaths = { INPUT_DIR + "/" + INPUT_FILE, "src/main/resources/" + INPUT_DIR + "/" + INPUT_FILE };
            for (String p : fsPaths) {
                Path f = Paths.get(p);
                if (Files.isRegularFile(f)) return load(f);
            }

            throw new EvalException("PARSE_ERROR: cannot find " + INPUT_FILE + " in resources/" + INPUT_DIR + "/");
        }

        static ObjectNode load(Path file) {
            if (!Files.isRegularFile(file)) throw new EvalException("IO_ERROR: no such file " + file);
            try {
                return asObject(ValueJson.MAPPER.readTree(file.toFile()), file.toString());
            } catch (IOException e) {
                throw new EvalException("PARSE_ERROR: cannot read " + file + " - " + e.getMessage(), e);
            }
        }

        static void save(ObjectNode json, Path file) {
            try {
                Path dir = file.toAbsolutePath().getParent();
                if (dir != null) Files.createDirectories(dir);
                ValueJson.MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), json);
            } catch (IOException e) {
                throw new EvalException("IO_ERROR: cannot write to " + file + " - " + e.getMessage(), e);
            }
        }

        static Path resolveOutputDir(String dirName) {
            // Prefer src/main/resources for development, fall back to current dir
            Path srcResources = Paths.get("src/main/resources", dirName);
            if (Files.exists(srcResources.getParent())) {
                return srcResources;
            }
            return Paths.get(dirName);
        }

        private static ObjectNode asObject(JsonNode node, String source) {
            if (node instanceof ObjectNode) return (ObjectNode) node;
            throw new EvalException("PARSE_ERROR: " + source + " must be a JSON object");
        }
    }
}
