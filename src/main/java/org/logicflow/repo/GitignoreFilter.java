package org.logicflow.repo;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 由一个 .gitignore 文件编译出的路径过滤器。{@link #test(Path)} 返回 true 表示保留该路径。
 * <p>
 * 规则按顺序匹配，最后一条匹配的规则生效；以 ! 开头的规则表示重新包含。
 * 不在 .gitignore 所在目录之下的路径总是保留。
 */
public final class GitignoreFilter implements Predicate<Path> {

    private record Rule(boolean negated, Pattern regex) {
    }

    private final Path baseDir;
    private final List<Rule> rules;

    private GitignoreFilter(Path baseDir, List<Rule> rules) {
        this.baseDir = baseDir;
        this.rules = rules;
    }

    public static GitignoreFilter load(Path gitignore) throws IOException {
        Path baseDir = gitignore.toAbsolutePath().normalize().getParent();
        return parse(baseDir, Files.readAllLines(gitignore, StandardCharsets.UTF_8));
    }

    public static GitignoreFilter parse(Path baseDir, List<String> lines) {
        List<Rule> rules = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.stripTrailing();
            // 跳过注释和空行
            if (line.startsWith("#") || line.isBlank()) {
                continue;
            }
            boolean negated = false;
            if (line.startsWith("!")) {
                negated = true;
                line = line.substring(1);
            }
            String pattern = line.strip();
            if (pattern.isEmpty()) {
                continue;
            }
            rules.add(new Rule(negated, Pattern.compile(toRegex(pattern))));
        }
        return new GitignoreFilter(baseDir.toAbsolutePath().normalize(), List.copyOf(rules));
    }

    /**
     * 把一条 .gitignore 模式转换为正则表达式：
     * {@code **} 可跨越目录，{@code *} 与 {@code ?} 不跨越 '/'；
     * 结尾的 '/' 匹配目录本身及其下所有内容；开头的 '/' 锚定到 .gitignore 所在目录。
     */
    static String toRegex(String pattern) {
        boolean anchored = pattern.startsWith("/");
        boolean dirOnly = pattern.endsWith("/");
        String body = trimSlashes(pattern);

        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '*') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '*') {
                    i++;
                    regex.append(".*");
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        if (dirOnly) {
            regex.append("(?:/.*)?");
        }
        return anchored ? "^" + regex + "$" : "(^|.*/)" + regex + "$";
    }

    @Override
    public boolean test(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!absolute.startsWith(baseDir)) {
            return true;
        }
        String relative = baseDir.relativize(absolute).toString().replace(File.separatorChar, '/');

        boolean matched = false;
        for (Rule rule : rules) {
            if (rule.regex().matcher(relative).matches()) {
                matched = !rule.negated();
            }
        }
        return !matched;
    }

    private static String trimSlashes(String pattern) {
        int start = 0;
        int end = pattern.length();
        while (start < end && pattern.charAt(start) == '/') {
            start++;
        }
        while (end > start && pattern.charAt(end - 1) == '/') {
            end--;
        }
        return pattern.substring(start, end);
    }
}
