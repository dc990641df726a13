package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.HistoryProperties;
import com.purchasingpower.codegraph.knowledge.HistoryEnricher;
import com.purchasingpower.codegraph.model.history.FileHistory;
import com.purchasingpower.codegraph.model.history.HistoryResult;
import com.purchasingpower.codegraph.model.history.RepositoryStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JGit-backed history enricher. The repository is discovered upward from the
 * scanned root, so a sub-directory of a work tree can be scanned too.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitHistoryEnricher implements HistoryEnricher {

    private final CodeGraphProperties properties;

    @Override
    public HistoryResult enrich(Path root, List<String> filePaths, ProgressCallback progress) {
        Optional<Repository> discovered = openRepository(root);
        if (discovered.isEmpty()) {
            log.info("⚠️ {} is not inside a git repository, skipping history", root);
            return HistoryResult.notVersionControlled();
        }

        HistoryProperties config = properties.getHistory();
        try (Repository repository = discovered.get(); Git git = new Git(repository)) {
            if (repository.resolve(Constants.HEAD) == null) {
                log.info("⚠️ Repository at {} has no commits yet", repository.getWorkTree());
                progress.onProgress(filePaths.size(), filePaths.size());
                return HistoryResult.of(Map.of(), RepositoryStats.empty());
            }

            String prefix = pathPrefix(repository, root);
            Map<String, FileHistory> histories = new LinkedHashMap<>();
            int total = filePaths.size();
            for (int start = 0; start < total; start += config.getBatchSize()) {
                int end = Math.min(start + config.getBatchSize(), total);
                for (String filePath : filePaths.subList(start, end)) {
                    try {
                        fileHistory(git, filePath, prefix + filePath, config.getMaxCommitsPerFile())
                            .ifPresent(history -> histories.put(filePath, history));
                    } catch (GitAPIException | RuntimeException e) {
                        log.warn("⚠️ Could not read history of {}: {}", filePath, e.getMessage());
                    }
                }
                progress.onProgress(end, total);
            }

            RepositoryStats stats = repositoryStats(git);
            log.info("✅ History collected for {}/{} files ({} commits, {} contributors)",
                histories.size(), total, stats.getTotalCommits(), stats.getContributorCount());
            return HistoryResult.of(histories, stats);
        } catch (IOException e) {
            // The repository exists but cannot be read; report it as empty history
            log.warn("⚠️ Failed to read git repository for {}: {}", root, e.getMessage());
            return HistoryResult.of(Map.of(), RepositoryStats.empty());
        }
    }

    private Optional<Repository> openRepository(Path root) {
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
            .setMustExist(true)
            .findGitDir(root.toAbsolutePath().toFile());
        if (builder.getGitDir() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(builder.build());
        } catch (IOException e) {
            log.warn("⚠️ Found git directory {} but could not open it: {}", builder.getGitDir(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Repository-relative prefix of the scanned root, e.g. {@code "module/"}, or empty.
     */
    private String pathPrefix(Repository repository, Path root) throws IOException {
        Path workTree = repository.getWorkTree().toPath().toRealPath();
        Path relative = workTree.relativize(root.toRealPath());
        String prefix = relative.toString().replace('\\', '/');
        return prefix.isEmpty() ? "" : prefix + "/";
    }

    private Optional<FileHistory> fileHistory(Git git, String filePath, String repositoryPath, int maxCommits)
        throws GitAPIException {
        List<RevCommit> commits = new ArrayList<>();
        git.log().addPath(repositoryPath).setMaxCount(maxCommits).call().forEach(commits::add);
        if (commits.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Contributor> byEmail = new LinkedHashMap<>();
        for (RevCommit commit : commits) {
            PersonIdent author = commit.getAuthorIdent();
            byEmail.computeIfAbsent(author.getEmailAddress(), email -> new Contributor(author.getName()))
                .commits++;
        }
        List<String> contributors = byEmail.values().stream()
            .sorted((a, b) -> Integer.compare(b.commits, a.commits))
            .map(contributor -> contributor.name)
            .collect(Collectors.toList());

        return Optional.of(FileHistory.builder()
            .filePath(filePath)
            .lastModified(commitTime(commits.get(0)))
            .commitCount(commits.size())
            .contributors(List.copyOf(contributors))
            .build());
    }

    private RepositoryStats repositoryStats(Git git) {
        try {
            ObjectId head = git.getRepository().resolve(Constants.HEAD);
            int total = 0;
            Set<String> emails = new HashSet<>();
            Instant newest = null;
            Instant oldest = null;
            for (RevCommit commit : git.log().add(head).call()) {
                Instant when = commitTime(commit);
                if (newest == null) {
                    newest = when;
                }
                oldest = when;
                emails.add(commit.getAuthorIdent().getEmailAddress());
                total++;
            }
            return RepositoryStats.builder()
                .totalCommits(total)
                .contributorCount(emails.size())
                .firstCommit(oldest)
                .lastCommit(newest)
                .build();
        } catch (IOException | GitAPIException e) {
            log.warn("⚠️ Could not compute repository statistics: {}", e.getMessage());
            return RepositoryStats.empty();
        }
    }

    private static Instant commitTime(RevCommit commit) {
        return commit.getAuthorIdent().getWhen().toInstant();
    }

    private static final class Contributor {
        private final String name;
        private int commits;

        private Contributor(String name) {
            this.name = name;
        }
    }
}
