/** Testing utilities. */
package utils;

import com.google.common.base.Throwables;
import com.google.common.io.Resources;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public class Utils {

@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Throwable;
}

/** @return The thrown exception for further inspection. */
public static <T extends Throwable> T
AssertThrows(Class<T> expectedThrowable, ThrowingRunnable runnable)
{
    try {
        runnable.run();
    } catch (Throwable e) {
        if (expectedThrowable.isInstance(e)) {
            System.out.println("Expected exception thrown: " + Throwables.getStackTraceAsString(e));
            return expectedThrowable.cast(e);
        }
        throw new AssertionError(
            String.format("Unexpected exception type thrown: expected %s thrown %s",
                          expectedThrowable.getSimpleName(), e.getClass().getSimpleName()),
            e);
    }
    throw new AssertionError(String.format("Expected %s to be thrown, but nothing was thrown",
                                           expectedThrowable.getSimpleName()));
}

/** Read UTF-8 text resource from the test class path. */
public static String
ReadResource(String name)
{
    try {
        return Resources.toString(Resources.getResource(name), StandardCharsets.UTF_8);
    } catch (IOException e) {
        throw new UncheckedIOException("Failed to read test resource " + name, e);
    }
}

}
