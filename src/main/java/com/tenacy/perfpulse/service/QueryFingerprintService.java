package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.domain.NormalizedQuery;
import com.tenacy.perfpulse.domain.NormalizedQueryRepository;
import com.tenacy.perfpulse.sql.SqlQueryNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 원시 SQL 을 정규화된 쿼리 형태로 바꾸고, 해당 형태의 행을 찾거나 만든다.
 */
@Service
@Slf4j
public class QueryFingerprintService {

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*[^*]*\\*/");

    private final NormalizedQueryRepository normalizedQueryRepository;
    private final SqlQueryNormalizer normalizer;
    private final TransactionTemplate requiresNew;

    public QueryFingerprintService(NormalizedQueryRepository normalizedQueryRepository,
                                   SqlQueryNormalizer normalizer,
                                   PlatformTransactionManager transactionManager) {
        this.normalizedQueryRepository = normalizedQueryRepository;
        this.normalizer = normalizer;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 주석 제거 + 정규화 + 길이 제한을 적용한 SQL 형태. 비어 있으면 {@code null}.
     */
    public String fingerprint(String rawSql) {
        if (rawSql == null) {
            return null;
        }
        String normalized = normalizer.normalize(BLOCK_COMMENT.matcher(rawSql).replaceAll("").trim());
        if (normalized == null || normalized.isEmpty()) {
            return null;
        }
        return normalized.length() > NormalizedQuery.MAX_SQL_LENGTH
                ? normalized.substring(0, NormalizedQuery.MAX_SQL_LENGTH)
                : normalized;
    }

    public Optional<NormalizedQuery> resolve(String rawSql) {
        String normalizedSql = fingerprint(rawSql);
        if (normalizedSql == null) {
            return Optional.empty();
        }

        Optional<NormalizedQuery> existing = normalizedQueryRepository.findByNormalizedSql(normalizedSql);
        if (existing.isPresent()) {
            return existing;
        }

        try {
            NormalizedQuery created = requiresNew.execute(status -> normalizedQueryRepository.saveAndFlush(
                    NormalizedQuery.builder().normalizedSql(normalizedSql).build()));
            log.debug("새 쿼리 형태 등록: id={}, sql={}", created.getId(), normalizedSql);
            return Optional.of(created);
        } catch (DataIntegrityViolationException e) {
            log.debug("쿼리 형태 동시 등록 감지, 기존 행 재조회: {}", normalizedSql);
            return Optional.of(normalizedQueryRepository.findByNormalizedSql(normalizedSql)
                    .orElseThrow(() -> e));
        }
    }
}
