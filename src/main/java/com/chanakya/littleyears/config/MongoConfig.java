package com.chanakya.littleyears.config;

import com.chanakya.littleyears.model.enums.MomentType;
import com.chanakya.littleyears.model.enums.Visibility;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.event.ValidatingMongoEventListener;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.util.List;

@Configuration
@EnableReactiveMongoAuditing
public class MongoConfig {

    // createdAt/updatedAt come from @CreatedDate/@LastModifiedDate on insert

    @Bean
    public ValidatingMongoEventListener validatingMongoEventListener(LocalValidatorFactoryBean validator) {
        return new ValidatingMongoEventListener(validator);
    }

    /**
     * Moment type and visibility are stored lower-case ("photo", "private"), matching existing data.
     */
    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(
                new MomentTypeWriter(), new MomentTypeReader(),
                new VisibilityWriter(), new VisibilityReader()
        ));
    }

    @WritingConverter
    static class MomentTypeWriter implements Converter<MomentType, String> {
        @Override
        public String convert(MomentType source) {
            return source.wireName();
        }
    }

    @ReadingConverter
    static class MomentTypeReader implements Converter<String, MomentType> {
        @Override
        public MomentType convert(String source) {
            return MomentType.fromWireName(source);
        }
    }

    @WritingConverter
    static class VisibilityWriter implements Converter<Visibility, String> {
        @Override
        public String convert(Visibility source) {
            return source.wireName();
        }
    }

    @ReadingConverter
    static class VisibilityReader implements Converter<String, Visibility> {
        @Override
        public Visibility convert(String source) {
            return Visibility.fromWireName(source);
        }
    }
}
