package alertconf.edit;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 以外部命令实现的保存钩子, 参数依次为 files, user, message, args...
 */
@Slf4j
public class CommandSaveHook implements SaveHook {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final Path command;
    private final Duration timeout;

    private CommandSaveHook(Path command, Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    /**
     * 创建钩子, 命令可以是绝对路径, 也可以是 PATH 中的命令名
     *
     * @throws HookNotFoundException 找不到可执行文件
     */
    public static CommandSaveHook create(String commandName, Duration timeout) {
        Path resolved = lookPath(commandName);
        log.info("注册保存钩子: {}", resolved);
        return new CommandSaveHook(resolved, timeout == null ? DEFAULT_TIMEOUT : timeout);
    }

    static Path lookPath(String commandName) {
        if (commandName == null || commandName.isBlank()) {
            throw new HookNotFoundException(String.valueOf(commandName));
        }
        if (commandName.contains(File.separator)) {
            Path path = Paths.get(commandName);
            if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                return path.toAbsolutePath();
            }
            throw new HookNotFoundException(commandName);
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isEmpty()) {
                    continue;
                }
                Path candidate = Paths.get(dir, commandName);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate;
                }
            }
        }
        throw new HookNotFoundException(commandName);
    }

    @Override
    public void onSave(String files, String user, String message, String... args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command.toString());
        cmd.add(files);
        cmd.add(user);
        cmd.add(message);
        cmd.addAll(Arrays.asList(args));

        log.info("执行保存钩子: {}", command);
        Path stdout = null;
        Path stderr = null;
        Process process = null;
        try {
            // 输出先落到临时文件, 避免管道写满阻塞子进程
            stdout = Files.createTempFile("save-hook-", ".out");
            stderr = Files.createTempFile("save-hook-", ".err");
            ProcessBuilder pb = new ProcessBuilder(cmd)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            process = pb.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new HookExecutionException(
                        String.format("保存钩子 %s 执行超时(%ss)", command, timeout.toSeconds()), read(stderr));
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String err = read(stderr);
                log.warn("保存钩子执行失败: exitCode={}, stderr={}", exitCode, err);
                throw new HookExecutionException(
                        String.format("保存钩子 %s 退出码 %d", command, exitCode), err);
            }
            log.info("保存钩子执行完成: {}", read(stdout));
        } catch (IOException e) {
            throw new HookExecutionException("启动保存钩子失败: " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new HookExecutionException("保存钩子执行被中断: " + command, e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    public Path getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("删除临时文件失败: {}", file, e);
        }
    }
}
