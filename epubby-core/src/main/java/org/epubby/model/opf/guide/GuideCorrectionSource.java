package org.epubby.model.opf.guide;

import java.util.Map;

/**
 * Contributes custom type to {@link ReferenceType} corrections. Declare implementations as Spring beans to have them
 * added to the {@link GuideReferenceCorrector}.
 */
@FunctionalInterface
public interface GuideCorrectionSource {

    Map<String, ReferenceType> getCorrections();
}
