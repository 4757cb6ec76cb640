package org.epubby.files;

import lombok.experimental.UtilityClass;
import org.epubby.exception.FileException;

import java.nio.file.FileVisitResult;
import java.util.List;

/**
 * Depth first walk over the resources below a directory. Recursion stops on {@link FileVisitResult#TERMINATE} or on
 * the first failure.
 */
@UtilityClass
class ResourceWalker {

    static void walk(DirectoryResource start, ResourceVisitor visitor) throws FileException {
        Resource current = start.refresh();
        if (current instanceof NilResource nil) {
            visitor.visitNil(nil, WalkStage.PRE_VISIT_DIRECTORY);
            return;
        }
        walkDirectory(current.asDirectory(), visitor);
    }

    private static FileVisitResult walkDirectory(DirectoryResource directory, ResourceVisitor visitor) throws FileException {
        FileVisitResult result = visitor.preVisitDirectory(directory);
        if (result != FileVisitResult.CONTINUE) {
            return result == FileVisitResult.SKIP_SUBTREE ? FileVisitResult.CONTINUE : result;
        }

        List<EpubPath> children;
        try {
            children = directory.listPaths();
        } catch (FileException e) {
            return visitor.postVisitDirectory(directory, e);
        }

        for (EpubPath child : children) {
            FileVisitResult childResult = visitChild(child, visitor);
            if (childResult == FileVisitResult.TERMINATE) {
                return FileVisitResult.TERMINATE;
            }
            if (childResult == FileVisitResult.SKIP_SIBLINGS) {
                break;
            }
        }

        Resource after = directory.refresh();
        if (after instanceof NilResource nil) {
            return visitor.visitNil(nil, WalkStage.POST_VISIT_DIRECTORY);
        }
        return visitor.postVisitDirectory(after.asDirectory(), null);
    }

    private static FileVisitResult visitChild(EpubPath child, ResourceVisitor visitor) throws FileException {
        Resource resource;
        try {
            resource = child.getResource();
        } catch (FileException e) {
            return visitor.visitFileFailed(child, e);
        }
        return switch (resource.getKind()) {
            case NIL -> visitor.visitNil((NilResource) resource, WalkStage.VISIT_FILE);
            case FILE -> visitor.visitFile((FileResource) resource);
            case DIRECTORY -> walkDirectory((DirectoryResource) resource, visitor);
        };
    }
}
