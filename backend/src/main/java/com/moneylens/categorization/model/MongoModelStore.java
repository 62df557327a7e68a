package com.moneylens.categorization.model;

import com.moneylens.domain.ClassifierModelDocument;
import com.moneylens.domain.ClassifierModelRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the current model as a single document in classifier_models; save replaces it.
 */
@Component
@RequiredArgsConstructor
public class MongoModelStore implements ModelStore {

    private final ClassifierModelRepository classifierModelRepository;

    @Override
    public Optional<String> load() {
        return classifierModelRepository.findById(ClassifierModelDocument.CURRENT)
                .map(ClassifierModelDocument::getBlob);
    }

    @Override
    public void save(String blob) {
        ClassifierModelDocument doc = new ClassifierModelDocument();
        doc.setId(ClassifierModelDocument.CURRENT);
        doc.setFormat(ModelCodec.FORMAT);
        doc.setBlob(blob);
        doc.setSavedAt(Instant.now());
        classifierModelRepository.save(doc);
    }
}
