package work.cmdkernel.demo;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import work.cmdkernel.bind.ParameterValues;
import work.cmdkernel.hooks.HookContext;
import work.cmdkernel.hooks.HookDecision;
import work.cmdkernel.runtime.HandlerRegistry;
import work.cmdkernel.runtime.InvocationContext;

/**
 * Handlers for the bundled sample model ({@value #MODEL_RESOURCE}).
 */
public final class DemoHandlers {
    public static final String MODEL_RESOURCE = "demo/commands.yaml";
    static final String STARTED_AT = "demo.startedAt";

    private final PrintStream out;

    private DemoHandlers(PrintStream out) {
        this.out = out;
    }

    public static HandlerRegistry register(HandlerRegistry registry, PrintStream out) {
        var demo = new DemoHandlers(out);
        registry.action("greet.say", demo::greet);
        registry.action("calc.add", demo::add);
        registry.action("calc.divide", demo::divide);
        registry.action("files.list", demo::listFiles);
        registry.beforeHook("demo.timing.start", DemoHandlers::startTimer);
        registry.afterHook("demo.timing.stop", demo::stopTimer);
        registry.errorHook("demo.report", demo::report);
        return registry;
    }

    private Object greet(InvocationContext ctx, ParameterValues values) {
        var text = values.getString("greeting") + ", " + values.getString("name") + "!";
        if (values.getBoolean("shout")) {
            text = text.toUpperCase(Locale.ROOT);
        } else if (values.getBoolean("whisper")) {
            text = text.toLowerCase(Locale.ROOT);
        }
        int times = values.get("times", Integer.class);
        for (int i = 0; i < times; i++) {
            ctx.ensureNotCancelled();
            out.println(text);
        }
        return text;
    }

    private Object add(InvocationContext ctx, ParameterValues values) {
        List<BigDecimal> numbers = values.getList("numbers");
        var sum = BigDecimal.ZERO;
        for (BigDecimal number : numbers) {
            sum = sum.add(number);
        }
        out.println(sum.toPlainString());
        return sum;
    }

    private Object divide(InvocationContext ctx, ParameterValues values) {
        var dividend = values.get("dividend", BigDecimal.class);
        var divisor = values.get("divisor", BigDecimal.class);
        var quotient = dividend.divide(divisor, MathContext.DECIMAL64).stripTrailingZeros();
        out.println(quotient.toPlainString());
        return quotient;
    }

    private Object listFiles(InvocationContext ctx, ParameterValues values) throws IOException {
        var directory = values.get("directory", Path.class);
        var showHidden = values.getBoolean("all");
        var names = new ArrayList<String>();
        try (var stream = Files.newDirectoryStream(directory, values.getString("pattern"))) {
            for (Path entry : stream) {
                var name = entry.getFileName().toString();
                if (showHidden || !name.startsWith(".")) {
                    names.add(Files.isDirectory(entry) ? name + "/" : name);
                }
            }
        }
        Collections.sort(names);
        names.forEach(out::println);
        return names.size();
    }

    private static HookDecision startTimer(HookContext ctx) {
        ctx.data().put(STARTED_AT, System.nanoTime());
        return HookDecision.proceed();
    }

    private void stopTimer(HookContext ctx, Object result) {
        var started = ctx.data().get(STARTED_AT);
        if (started instanceof Long nanos && ctx.globalOptions().getBoolean("verbose")) {
            out.printf("(%s took %d ms)%n", ctx.actionName(), (System.nanoTime() - nanos) / 1_000_000);
        }
    }

    private boolean report(HookContext ctx, Throwable error) {
        var message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        out.println("error: " + ctx.commandPath() + " " + ctx.actionName() + ": " + message);
        return true;
    }
}
