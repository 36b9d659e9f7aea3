package netlab.provisioner.console;

/**
 * Output of a sentinel-wrapped command and the exit code the shell reported.
 *
 * @param output   captured text before the last sentinel, or everything when no sentinel arrived
 * @param exitCode null when the sentinel never arrived or its code could not be parsed
 */
public record CommandResult(String output, Integer exitCode) {

    /**
     * Split raw console text on the last occurrence of {@code sentinel}.
     * The command line echoed by the terminal also contains the sentinel, so
     * only the last occurrence marks completion.
     */
    public static CommandResult parse(String raw, String sentinel) {
        String text = raw == null ? "" : raw;
        int idx = text.lastIndexOf(sentinel);
        if (idx < 0) {
            return new CommandResult(text, null);
        }
        String output = text.substring(0, idx);
        String suffix = text.substring(idx + sentinel.length());
        String firstLine = suffix.lines().findFirst().orElse("").trim();
        Integer code;
        try {
            code = Integer.parseInt(firstLine);
        } catch (NumberFormatException e) {
            code = null;
        }
        return new CommandResult(output, code);
    }

    public boolean completed() {
        return exitCode != null;
    }

    public boolean succeeded() {
        return exitCode != null && exitCode == 0;
    }
}
