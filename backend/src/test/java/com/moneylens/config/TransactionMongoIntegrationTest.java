package com.moneylens.config;

import com.moneylens.domain.Transaction;
import com.moneylens.domain.TransactionRepository;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class TransactionMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;
    @Autowired
    TransactionRepository transactionRepository;

    @Test
    @DisplayName("amount is stored as Decimal128 and read back exactly")
    void amountAsDecimal128() {
        Transaction tx = new Transaction();
        tx.setDescription("Electricity bill payment");
        tx.setAmount(new BigDecimal("-850.05"));
        tx.setDate(LocalDate.of(2025, 11, 14));
        Transaction saved = transactionRepository.save(tx);

        Document raw = mongoTemplate.getCollection("transactions").find(new Document("_id",
                new ObjectId(saved.getId()))).first();
        assertThat(raw).isNotNull();
        assertThat(raw.get("amount")).isInstanceOf(Decimal128.class);

        Transaction read = transactionRepository.findById(saved.getId()).orElseThrow();
        assertThat(read.getAmount()).isEqualByComparingTo("-850.05");
        assertThat(read.isReconciled()).isFalse();
    }

    @Test
    @DisplayName("uncategorized and date-window queries")
    void repositoryQueries() {
        transactionRepository.deleteAll();
        Transaction blank = new Transaction();
        blank.setDescription("a");
        blank.setCategory("");
        blank.setAmount(BigDecimal.ONE.negate());
        blank.setDate(LocalDate.of(2025, 11, 10));
        Transaction missing = new Transaction();
        missing.setDescription("b");
        missing.setAmount(BigDecimal.TEN.negate());
        missing.setDate(LocalDate.of(2025, 11, 20));
        Transaction done = new Transaction();
        done.setDescription("c");
        done.setCategory("Food");
        done.setAmount(BigDecimal.TEN.negate());
        done.setDate(LocalDate.of(2025, 11, 12));
        transactionRepository.save(blank);
        transactionRepository.save(missing);
        transactionRepository.save(done);

        assertThat(transactionRepository.findUncategorized(PageRequest.of(0, 10)))
                .extracting(Transaction::getDescription).containsExactlyInAnyOrder("a", "b");
        assertThat(transactionRepository.findByReconciledFalseAndDateBetweenOrderByDateAsc(
                LocalDate.of(2025, 11, 9), LocalDate.of(2025, 11, 13)))
                .extracting(Transaction::getDescription).containsExactly("a", "c");
    }
}
