package work.deeployd.workflow.deps;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Line-based scanner for {@code import} statements in python source. Only top-level module names are
 * reported, translated to their distribution name where the two differ.
 */
public final class PythonImports {
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(.+)$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\.*[\\w.]*)\\s+import\\b.*$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Map<String, String> DISTRIBUTIONS = Map.ofEntries(
        Map.entry("PIL", "pillow"),
        Map.entry("cv2", "opencv-python"),
        Map.entry("sklearn", "scikit-learn"),
        Map.entry("skimage", "scikit-image"),
        Map.entry("yaml", "pyyaml"),
        Map.entry("bs4", "beautifulsoup4"),
        Map.entry("dateutil", "python-dateutil"),
        Map.entry("Crypto", "pycryptodome"),
        Map.entry("git", "gitpython"),
        Map.entry("attr", "attrs"),
        Map.entry("dotenv", "python-dotenv"),
        Map.entry("magic", "python-magic"),
        Map.entry("serial", "pyserial"),
        Map.entry("fitz", "pymupdf"),
        Map.entry("jwt", "pyjwt")
    );

    private PythonImports() {}

    public static Set<String> scan(String source) {
        var packages = new TreeSet<String>();
        if (source == null || source.isBlank()) {
            return packages;
        }
        for (var line : source.split("\\R")) {
            var hash = line.indexOf('#');
            var code = hash >= 0 ? line.substring(0, hash) : line;
            for (var statement : code.split(";")) {
                readStatement(statement.trim(), packages);
            }
        }
        return packages;
    }

    public static String distributionName(String module) {
        return DISTRIBUTIONS.getOrDefault(module, module);
    }

    private static void readStatement(String statement, Set<String> packages) {
        var from = FROM_IMPORT.matcher(statement);
        if (from.matches()) {
            var module = from.group(1);
            // relative imports belong to the node pack itself
            if (!module.isEmpty() && !module.startsWith(".")) {
                addModule(module, packages);
            }
            return;
        }
        var plain = IMPORT.matcher(statement);
        if (plain.matches()) {
            for (var part : plain.group(1).split(",")) {
                var name = part.trim();
                var alias = name.indexOf(" as ");
                if (alias >= 0) {
                    name = name.substring(0, alias).trim();
                }
                addModule(name, packages);
            }
        }
    }

    private static void addModule(String dotted, Set<String> packages) {
        var top = dotted.split("\\.", 2)[0].trim();
        if (IDENTIFIER.matcher(top).matches()) {
            packages.add(distributionName(top));
        }
    }
}
