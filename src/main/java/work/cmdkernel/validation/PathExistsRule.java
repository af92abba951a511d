package work.cmdkernel.validation;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Requires a path value to exist, optionally as a regular file or a directory.
 */
public final class PathExistsRule implements ValidationRule {
    private enum Expect {
        ANY,
        FILE,
        DIRECTORY
    }

    private final Expect expect;

    private PathExistsRule(Expect expect) {
        this.expect = expect;
    }

    public static PathExistsRule any() {
        return new PathExistsRule(Expect.ANY);
    }

    public static PathExistsRule file() {
        return new PathExistsRule(Expect.FILE);
    }

    public static PathExistsRule directory() {
        return new PathExistsRule(Expect.DIRECTORY);
    }

    @Override
    public String name() {
        return switch (expect) {
            case ANY -> "path-exists";
            case FILE -> "file-exists";
            case DIRECTORY -> "directory-exists";
        };
    }

    @Override
    public void validate(Object value, String parameterName) {
        var path = toPath(value);
        if (path == null) {
            throw new ValidationException(name(), value,
                "Parameter '" + parameterName + "' value '" + value + "' is not a path");
        }
        boolean ok = switch (expect) {
            case ANY -> Files.exists(path);
            case FILE -> Files.isRegularFile(path);
            case DIRECTORY -> Files.isDirectory(path);
        };
        if (!ok) {
            var what = switch (expect) {
                case ANY -> "Path";
                case FILE -> "File";
                case DIRECTORY -> "Directory";
            };
            throw new ValidationException(name(), value,
                what + " not found for parameter '" + parameterName + "': " + path);
        }
    }

    private static Path toPath(Object value) {
        if (value instanceof Path path) {
            return path;
        }
        if (value instanceof File file) {
            return file.toPath();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Path.of(text);
        }
        return null;
    }
}
