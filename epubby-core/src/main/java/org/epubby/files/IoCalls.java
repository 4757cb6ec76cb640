package org.epubby.files;

import lombok.experimental.UtilityClass;
import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.io.IOException;
import java.nio.file.ClosedFileSystemException;

@UtilityClass
class IoCalls {

    @FunctionalInterface
    interface IoAction<T> {
        T run() throws IOException;
    }

    @FunctionalInterface
    interface IoRunnable {
        void run() throws IOException;
    }

    static <T> T call(EpubPath path, IoAction<T> action) throws FileException {
        path.getFileSystem().ensureOpen(path);
        try {
            return action.run();
        } catch (IOException e) {
            throw FileError.fromIOException(path.toString(), e);
        } catch (ClosedFileSystemException e) {
            throw FileError.fromClosedFileSystem(path.toString(), e);
        }
    }

    static void run(EpubPath path, IoRunnable action) throws FileException {
        call(path, () -> {
            action.run();
            return null;
        });
    }
}
