package tech.yump.envr.process;

/**
 * Exit code and captured output of one finished command.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
