module io.github.cyfko.algezip.cli {
    requires io.github.cyfko.algezip.core;
    requires java.logging;

    exports io.github.cyfko.algezip.cli;
    exports io.github.cyfko.algezip.cli.command;
    exports io.github.cyfko.algezip.cli.exception;
}
