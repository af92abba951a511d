package work.cmdkernel.hooks;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandNode;

class ExitCodeResolverTest {
    private final ActionNode action = ActionNode.builder("sync")
        .exitCode(FileNotFoundException.class, 3)
        .build();
    private final CommandNode inner = CommandNode.builder("remote")
        .exitCode(IOException.class, 74)
        .exitCode(FileNotFoundException.class, 30)
        .action(action)
        .build();
    private final CommandNode outer = CommandNode.builder("repo")
        .exitCode(RuntimeException.class, 70)
        .exitCode(IOException.class, 5)
        .child(inner)
        .build();
    private final List<CommandNode> path = List.of(outer, inner);

    @Test
    void actionMappingWinsForTheSameType() {
        assertEquals(3, ExitCodeResolver.resolve(new FileNotFoundException(), path, action, 1));
    }

    @Test
    void innermostCommandWinsOverOuter() {
        assertEquals(74, ExitCodeResolver.resolve(new IOException(), path, action, 1));
    }

    @Test
    void closestSuperclassMappingApplies() {
        assertEquals(74, ExitCodeResolver.resolve(new NoSuchFileException("x"), path, action, 1));
        assertEquals(70, ExitCodeResolver.resolve(new IllegalStateException(), path, action, 1));
    }

    @Test
    void unmappedFailureUsesFallback() {
        assertEquals(1, ExitCodeResolver.resolve(new Exception(), path, action, 1));
        assertEquals(1, ExitCodeResolver.resolve(new AssertionError(), path, action, 1));
    }
}
