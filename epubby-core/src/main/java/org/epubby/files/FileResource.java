package org.epubby.files;

import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

public final class FileResource extends ExistingResource {

    FileResource(EpubPath path, ResourceAccess access) {
        super(path, access);
    }

    @Override
    public ResourceKind getKind() {
        return ResourceKind.FILE;
    }

    public long getSize() throws FileException {
        return IoCalls.call(path, () -> Files.size(path.getDelegate()));
    }

    @Override
    public boolean isEmpty() throws FileException {
        return getSize() == 0L;
    }

    public byte[] readBytes() throws FileException {
        return IoCalls.call(path, () -> Files.readAllBytes(path.getDelegate()));
    }

    public String readText() throws FileException {
        return readText(StandardCharsets.UTF_8);
    }

    public String readText(Charset charset) throws FileException {
        return IoCalls.call(path, () -> Files.readString(path.getDelegate(), charset));
    }

    public List<String> readLines(Charset charset) throws FileException {
        return IoCalls.call(path, () -> Files.readAllLines(path.getDelegate(), charset));
    }

    public InputStream newInputStream() throws FileException {
        return IoCalls.call(path, () -> Files.newInputStream(path.getDelegate()));
    }

    public void writeText(CharSequence text) throws FileException {
        writeText(text, StandardCharsets.UTF_8);
    }

    public void writeText(CharSequence text, Charset charset) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.writeString(path.getDelegate(), text, charset));
    }

    public void appendText(CharSequence text, Charset charset) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.writeString(path.getDelegate(), text, charset, StandardOpenOption.APPEND));
    }

    public void writeBytes(byte[] bytes) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.write(path.getDelegate(), bytes));
    }

    public void appendBytes(byte[] bytes) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.write(path.getDelegate(), bytes, StandardOpenOption.APPEND));
    }

    public FileResource writeLines(Iterable<? extends CharSequence> lines, Charset charset) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.write(path.getDelegate(), lines, charset));
        return this;
    }

    public FileResource appendLines(Iterable<? extends CharSequence> lines, Charset charset) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.write(path.getDelegate(), lines, charset, StandardOpenOption.APPEND));
        return this;
    }

    /**
     * Raw stream access, only handed out for {@link ResourceAccess#UNPROTECTED} files.
     */
    public OutputStream newOutputStream(OpenOption... options) throws FileException {
        requireAccess(ResourceAccess.UNPROTECTED);
        return IoCalls.call(path, () -> Files.newOutputStream(path.getDelegate(), options));
    }

    public SeekableByteChannel newByteChannel(OpenOption... options) throws FileException {
        requireAccess(ResourceAccess.UNPROTECTED);
        Set<OpenOption> optionSet = Set.of(options);
        return IoCalls.call(path, () -> Files.newByteChannel(path.getDelegate(), optionSet));
    }

    /**
     * Copies this file onto {@code target}. A {@link NilResource} target is created, an existing file is only replaced
     * when {@link StandardCopyOption#REPLACE_EXISTING} is given and the file is modifiable.
     */
    public FileResource copyTo(Resource target, CopyOption... options) throws FileException {
        getFileSystem().ensureOwned(target.getPath());
        if (target.isDirectory()) {
            throw FileError.NOT_FILE.createException(target.getPath().toString(), path.toString());
        }
        requireWritableTarget(target);
        if (target.isFile() && !Arrays.asList(options).contains(StandardCopyOption.REPLACE_EXISTING)) {
            throw FileError.RESOURCE_ALREADY_EXISTS.createException(target.getPath().toString(), path.toString());
        }
        IoCalls.run(path, () -> Files.copy(path.getDelegate(), target.getPath().getDelegate(), options));
        return target.refresh().asFile();
    }

    public FileResource copyInto(DirectoryResource directory, CopyOption... options) throws FileException {
        return copyTo(directory.resolve(getName()), options);
    }

    @Override
    public FileResource moveTo(Resource target) throws FileException {
        return moveTo(target, new CopyOption[0]);
    }

    public FileResource moveTo(Resource target, CopyOption... options) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        getFileSystem().ensureOwned(target.getPath());
        if (target.isDirectory()) {
            throw FileError.NOT_FILE.createException(target.getPath().toString(), path.toString());
        }
        requireWritableTarget(target);
        IoCalls.run(path, () -> Files.move(path.getDelegate(), target.getPath().getDelegate(), options));
        return target.refresh().asFile();
    }

    @Override
    public FileResource renameTo(String name, boolean overwrite) throws FileException {
        Resource target = path.resolveSibling(name).getResource();
        if (target.isFile() && !overwrite) {
            throw FileError.RESOURCE_ALREADY_EXISTS.createException(target.getPath().toString(), path.toString());
        }
        return overwrite ? moveTo(target, StandardCopyOption.REPLACE_EXISTING) : moveTo(target);
    }
}
