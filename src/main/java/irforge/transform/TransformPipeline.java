package irforge.transform;

import irforge.base.items.FunDecl;
import irforge.transform.structure.Structurer;
import irforge.utils.Logging;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every transformation on a translated crate: the per-body micro-passes and structuring in
 * parallel, then the whole-crate passes once every body is done.
 */
public class TransformPipeline {
    private final TransformCtx ctx;
    private final List<Pass.UllbcPass> ullbcPasses = new ArrayList<>();
    private final List<Pass.LlbcPass> llbcPasses = new ArrayList<>();
    private final List<Pass.CratePass> cratePasses = new ArrayList<>();

    public TransformPipeline(TransformCtx ctx) {
        this.ctx = ctx;
        for (var pass : List.<Pass.UllbcPass>of(new ReconstructAsserts(), new MergeGotoChains(),
                new RemoveArithmeticOverflowChecks(), new RemoveNops(), new RemoveUnusedLocals())) {
            if (ctx.options.isPassEnabled(pass.name())) {
                ullbcPasses.add(pass);
            }
        }
        for (var pass : List.<Pass.LlbcPass>of(new RecoverBodyComments())) {
            if (ctx.options.isPassEnabled(pass.name())) {
                llbcPasses.add(pass);
            }
        }
        for (var pass : List.<Pass.CratePass>of(new RemoveUnusedSelfClause(), new ReorderDecls())) {
            if (ctx.options.isPassEnabled(pass.name())) {
                cratePasses.add(pass);
            }
        }
    }

    public void run() {
        long begin = System.currentTimeMillis();
        transformBodies();
        long bodies = System.currentTimeMillis();
        Logging.debug("TransformPipeline", "Body passes time: " + (bodies - begin) / 1000.00 + "s");

        var lock = ctx.crate.lock.writeLock();
        lock.lock();
        try {
            for (Pass.CratePass pass : cratePasses) {
                Logging.debug("TransformPipeline", "Running " + pass.name());
                pass.transformCrate(ctx);
            }
        } finally {
            lock.unlock();
        }
    }

    private void transformBodies() {
        List<FunDecl> funs = new ArrayList<>(ctx.crate.funDecls.values());
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, ctx.options.threads));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (FunDecl fun : funs) {
                if (fun.unstructuredBody != null) {
                    futures.add(executor.submit(() -> transformFun(fun)));
                }
            }
            try {
                for (Future<?> future : futures) {
                    join(future);
                }
            } catch (RuntimeException | Error e) {
                Logging.warn("TransformPipeline", "Cancelling remaining bodies: " + e.getMessage());
                futures.forEach(future -> future.cancel(true));
                throw e;
            }
        } finally {
            executor.shutdown();
        }
    }

    /** Micro-passes, structuring, then the structured-body passes, on one function. */
    void transformFun(FunDecl fun) {
        var lock = ctx.crate.lock.readLock();
        lock.lock();
        try {
            var body = fun.unstructuredBody;
            for (Pass.UllbcPass pass : ullbcPasses) {
                Logging.trace("TransformPipeline", String.format("%s on %s", pass.name(), fun.meta.name));
                pass.transformBody(ctx, body);
            }
            fun.structuredBody = new Structurer(body, ctx.store()).structure();
            fun.unstructuredBody = null;
            for (Pass.LlbcPass pass : llbcPasses) {
                pass.transformBody(ctx, fun.structuredBody);
            }
        } finally {
            lock.unlock();
        }
    }

    private static void join(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while transforming bodies", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            } else if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }
}
