package com.moneylens.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Money is stored as Decimal128 (transaction amounts, bill and loan payment amounts, loan balances).
 * Indexes come from @CompoundIndex / @Indexed on the documents (spring.data.mongodb.auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(AmountWritingConverter.INSTANCE, AmountReadingConverter.INSTANCE));
    }

    /** Rounds to 34 significant digits, the Decimal128 limit. */
    @WritingConverter
    enum AmountWritingConverter implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source.round(MathContext.DECIMAL128));
        }
    }

    @ReadingConverter
    enum AmountReadingConverter implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
