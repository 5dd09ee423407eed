package com.regesh.inference;

import com.regesh.config.InferenceConfig;
import com.regesh.pipeline.PipelineSetupException;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates {@link Classifier} instances from configuration using reflection.
 * Keeps the pipeline agnostic to concrete classifier implementations.
 */
@Slf4j
public final class ClassifierFactory {

    private ClassifierFactory() {
        // utility class
    }

    /**
     * Instantiates a classifier from the class name specified in the config,
     * then initialises it.
     *
     * @param config the inference configuration
     * @return an initialised classifier instance
     * @throws PipelineSetupException if the class cannot be loaded, instantiated or initialised
     */
    public static Classifier create(InferenceConfig config) {
        String className = config.getClassName();
        try {
            Class<?> clazz = Class.forName(className);
            if (!Classifier.class.isAssignableFrom(clazz)) {
                throw new PipelineSetupException(PipelineSetupException.STAGE_CLASSIFIER,
                        "Class " + className + " does not implement Classifier");
            }
            Classifier classifier = (Classifier) clazz.getDeclaredConstructor().newInstance();
            classifier.init(config);
            log.info("Created classifier {} for model '{}'", className, config.getModelName());
            return classifier;
        } catch (ReflectiveOperationException e) {
            throw new PipelineSetupException(PipelineSetupException.STAGE_CLASSIFIER,
                    "Failed to create classifier " + className, e);
        } catch (PipelineSetupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineSetupException(PipelineSetupException.STAGE_CLASSIFIER,
                    "Failed to initialise classifier " + className, e);
        }
    }
}
