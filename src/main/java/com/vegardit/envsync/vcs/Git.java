/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.envsync.vcs;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.apache.commons.io.IOUtils;
import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.SystemUtils;
import net.sf.jstuff.core.io.Processes;
import net.sf.jstuff.core.logging.Logger;

/**
 * Synchronous, non-interactive wrapper around the git command line client.
 * <p>
 * The exit code is the only success signal. Helper methods that mutate a repository throw a
 * {@link GitCommandException} carrying the captured stderr when git exits with a non-zero status.
 */
public class Git {

   private static final Logger LOG = Logger.create();

   /**
    * Name of the remote registered in target repositories that points to the source repository.
    */
   public static final String SOURCE_REMOTE = "envsync-source";

   private final String executable;

   public Git() {
      this("git");
   }

   public Git(final String executable) {
      this.executable = executable;
   }

   /**
    * @return true if a git executable can be found on the PATH
    */
   public static boolean isInstalled() {
      return SystemUtils.findExecutable(SystemUtils.IS_OS_WINDOWS ? "git.exe" : "git", false) != null;
   }

   private static String readFully(final InputStream in) {
      try (in) {
         return IOUtils.toString(in, StandardCharsets.UTF_8);
      } catch (final IOException ex) {
         throw new UncheckedIOException(ex);
      }
   }

   /**
    * Executes git with the given arguments.
    *
    * @param repo if not null, passed to git via {@code -C}
    */
   public GitResult run(final @Nullable Path repo, final String... args) throws IOException {
      final var command = new ArrayList<String>();
      if (repo != null) {
         command.add("-C");
         command.add(repo.toString());
      }
      command.addAll(List.of(args));

      final var commandLine = new ArrayList<String>(command.size() + 1);
      commandLine.add(executable);
      commandLine.addAll(command);
      LOG.debug("Executing [%s]...", String.join(" ", commandLine));

      final var proc = Processes.builder(executable) //
         .withArgs(command) //
         .withEnvironment(env -> {
            env.put("GIT_TERMINAL_PROMPT", "0");
            env.put("LC_ALL", "C");
         }) //
         .start();

      try {
         proc.getStdIn().close();
         final var stderr = CompletableFuture.supplyAsync(() -> readFully(proc.getStdErr()));
         final var stdout = readFully(proc.getStdOut());
         proc.waitForExit();
         final var result = new GitResult(commandLine, proc.exitStatus(), stdout, stderr.join());
         if (!result.isSuccess()) {
            LOG.debug("[%s] exited with %s: %s", String.join(" ", commandLine), result.exitCode(), Strings.trim(result.stderr()));
         }
         return result;
      } catch (final InterruptedException ex) {
         Thread.currentThread().interrupt();
         proc.kill();
         throw new InterruptedIOException("Interrupted while waiting for [" + String.join(" ", commandLine) + "]");
      } catch (final UncheckedIOException ex) {
         throw ex.getCause();
      } catch (final CompletionException ex) {
         if (ex.getCause() instanceof final UncheckedIOException uioe)
            throw uioe.getCause();
         throw ex;
      }
   }

   /**
    * @return true if the given directory is the root of a git working tree
    */
   public boolean isRepository(final Path dir) {
      return Files.isDirectory(dir) && Files.exists(dir.resolve(".git"));
   }

   /**
    * Resolves the given ref to a commit id.
    *
    * @return null if the ref cannot be resolved, e.g. in an empty repository
    */
   public @Nullable String revParse(final Path repo, final String ref) {
      try {
         final var result = run(repo, "rev-parse", "--verify", "--quiet", ref);
         if (!result.isSuccess())
            return null;
         final var id = Strings.trim(result.stdout());
         return id.isEmpty() ? null : id;
      } catch (final IOException ex) {
         LOG.warn("Cannot resolve [%s] in [%s]: %s", ref, repo, ex.getMessage());
         return null;
      }
   }

   /**
    * @return true if the working tree has neither modified nor untracked files
    */
   public boolean isClean(final Path repo) throws IOException {
      return Strings.isBlank(run(repo, "status", "--porcelain").orThrow().stdout());
   }

   public void cloneRepository(final Path source, final Path target) throws IOException {
      final var parent = target.toAbsolutePath().getParent();
      if (parent != null) {
         Files.createDirectories(parent);
      }
      run(null, "clone", "--quiet", source.toString(), target.toString()).orThrow();
   }

   /**
    * Registers a remote. If a remote with the same name already exists, its URL is updated instead.
    */
   public void addOrUpdateRemote(final Path repo, final String name, final String url) throws IOException {
      final var result = run(repo, "remote", "add", name, url);
      if (result.isSuccess())
         return;
      if (!result.stderr().contains("already exists"))
         throw new GitCommandException(result);
      run(repo, "remote", "set-url", name, url).orThrow();
   }

   public void fetch(final Path repo, final String remote) throws IOException {
      run(repo, "fetch", "--quiet", remote).orThrow();
   }

   /**
    * @return the short name of the checked out branch, {@code HEAD} for a detached head
    */
   public String currentBranch(final Path repo) throws IOException {
      return Strings.trim(run(repo, "rev-parse", "--abbrev-ref", "HEAD").orThrow().stdout());
   }

   public void resetHard(final Path repo, final String ref) throws IOException {
      run(repo, "reset", "--hard", "--quiet", ref).orThrow();
   }

   /**
    * Removes untracked files and directories.
    */
   public void cleanUntracked(final Path repo) throws IOException {
      run(repo, "clean", "-fd", "--quiet").orThrow();
   }
}
