module io.github.cyfko.algezip.core {
    requires java.logging;

    exports io.github.cyfko.algezip.core.api;
    exports io.github.cyfko.algezip.core.config;
    exports io.github.cyfko.algezip.core.exception;
    exports io.github.cyfko.algezip.core.impl;
    exports io.github.cyfko.algezip.core.model;
    exports io.github.cyfko.algezip.core.parsing;
    exports io.github.cyfko.algezip.core.render;
    exports io.github.cyfko.algezip.core.rules;
    exports io.github.cyfko.algezip.core.zipper;
}
