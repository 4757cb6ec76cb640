package org.epubby.config;

import org.epubby.model.opf.guide.GuideCorrectionSource;
import org.epubby.model.opf.guide.GuideReferenceCorrector;
import org.epubby.model.opf.metadata.MarcRelatorConverter;
import org.epubby.model.opf.metadata.Opf3MetaConverter;
import org.epubby.model.opf.metadata.Opf3MetaConverters;
import org.epubby.service.reader.EpubReaderService;
import org.epubby.service.writer.EpubWriterService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.util.stream.Collectors;

@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackageClasses = {EpubProperties.class, EpubReaderService.class, EpubWriterService.class})
public class EpubConfig {

    @Bean
    public MarcRelatorConverter marcRelatorConverter() {
        return new MarcRelatorConverter();
    }

    @Bean
    public Opf3MetaConverters opf3MetaConverters(ObjectProvider<Opf3MetaConverter<?>> converters) {
        return new Opf3MetaConverters(converters.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public GuideReferenceCorrector guideReferenceCorrector(EpubProperties properties,
                                                           ObjectProvider<GuideCorrectionSource> sources) {
        return new GuideReferenceCorrector(properties.getDefaultGuideCorrections(),
                sources.orderedStream().collect(Collectors.toList()));
    }
}
