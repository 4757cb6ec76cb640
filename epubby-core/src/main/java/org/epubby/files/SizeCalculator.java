package org.epubby.files;

import lombok.Getter;
import org.epubby.exception.FileException;

import java.math.BigInteger;
import java.nio.file.FileVisitResult;

@Getter
class SizeCalculator implements ResourceVisitor {

    private BigInteger total = BigInteger.ZERO;

    @Override
    public FileVisitResult visitFile(FileResource file) throws FileException {
        total = total.add(BigInteger.valueOf(file.getSize()));
        return FileVisitResult.CONTINUE;
    }
}
