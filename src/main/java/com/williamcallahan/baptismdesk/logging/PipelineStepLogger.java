package com.williamcallahan.baptismdesk.logging;

import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.pipeline.CertificateStepException;
import java.util.List;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Times every pipeline job and logs its start, outcome and duration to the {@code PIPELINE}
 * logger, tagged with the profile id the job works on.
 */
@Aspect
@Component
public class PipelineStepLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    /**
     * Log upload processing
     */
    @Around("execution(* com.williamcallahan.baptismdesk.pipeline.UploadPipeline.upload(..))")
    public Object logUpload(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed("UPLOAD", "staged-file", joinPoint);
    }

    /**
     * Log field extraction
     */
    @Around("execution(* com.williamcallahan.baptismdesk.pipeline.ExtractionPipeline.extract(..))")
    public Object logExtraction(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed("EXTRACTION", subjectOf(joinPoint.getArgs()), joinPoint);
    }

    /**
     * Log certificate generation
     */
    @Around("execution(* com.williamcallahan.baptismdesk.pipeline.CertificatePipeline.generate(..))")
    public Object logCertificate(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed("CERTIFICATE", subjectOf(joinPoint.getArgs()), joinPoint);
    }

    /**
     * Log certificate merging
     */
    @Around("execution(* com.williamcallahan.baptismdesk.pipeline.CertificateCombiner.combine(..))")
    public Object logCombine(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed("COMBINE", subjectOf(joinPoint.getArgs()), joinPoint);
    }

    private Object timed(String stage, String subject, ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.currentTimeMillis();
        PIPELINE_LOG.info("[{}] {} - Starting on {}", subject, stage, Thread.currentThread().getName());
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms", describeResult(subject, result), stage, duration);
            return result;
        } catch (CertificateStepException e) {
            PIPELINE_LOG.error("[{}] {} - Failed at step {} after {}ms: {}",
                    subject, stage, e.getStep(), System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed after {}ms: {}",
                    subject, stage, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }
    }

    private static String subjectOf(Object[] args) {
        if (args.length == 0 || args[0] == null) {
            return "-";
        }
        Object first = args[0];
        if (first instanceof Profile profile) {
            return profile.id();
        }
        if (first instanceof List<?> ids) {
            return ids.size() + " profiles";
        }
        return first.toString();
    }

    private static String describeResult(String subject, Object result) {
        return result instanceof Profile profile ? profile.id() : subject;
    }
}
