/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.edgelet.core;

import com.edgelet.exception.InstanceCreationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class InstanceFactoryTests {
	@Test
	public void freshVendsNewInstances() {
		InstanceFactory<App> instanceFactory = InstanceFactory.fresh(() -> new App(new AtomicInteger()));

		Assertions.assertEquals(InstanceFactory.Mode.FRESH, instanceFactory.getMode());
		Assertions.assertNotSame(instanceFactory.create(), instanceFactory.create());
	}

	@Test
	public void freshInstancesAreIsolatedUnderConcurrency() throws Exception {
		AtomicInteger sharedCounter = new AtomicInteger();
		InstanceFactory<App> instanceFactory = InstanceFactory.fresh(() -> new App(sharedCounter));
		int requestCount = 16;
		ExecutorService executorService = Executors.newFixedThreadPool(requestCount);
		CountDownLatch startLatch = new CountDownLatch(1);

		try {
			List<Future<Integer>> futures = new ArrayList<>();

			for (int i = 0; i < requestCount; ++i) {
				int requestNumber = i;

				futures.add(executorService.submit(() -> {
					App app = instanceFactory.create();
					startLatch.await();

					// Each "request" writes its own number many times; a shared instance would interleave
					for (int j = 0; j < 1_000; ++j)
						app.scratch = requestNumber;

					app.counter.incrementAndGet();
					return app.scratch;
				}));
			}

			startLatch.countDown();

			for (int i = 0; i < requestCount; ++i)
				Assertions.assertEquals(i, futures.get(i).get(5, TimeUnit.SECONDS));

			Assertions.assertEquals(requestCount, sharedCounter.get());
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void seedCopySharesHandlesButNotState() {
		AtomicInteger counter = new AtomicInteger();
		App seed = new App(counter);
		seed.scratch = 7;

		InstanceFactory<App> instanceFactory = InstanceFactory.copying(seed, app -> new App(app.counter));

		App first = instanceFactory.create();
		App second = instanceFactory.create();

		Assertions.assertEquals(InstanceFactory.Mode.SEED_COPY, instanceFactory.getMode());
		Assertions.assertNotSame(first, second);
		Assertions.assertNotSame(seed, first);
		Assertions.assertSame(counter, first.counter);
		Assertions.assertSame(counter, second.counter);
		Assertions.assertEquals(0, first.scratch);

		first.counter.incrementAndGet();
		second.counter.incrementAndGet();

		Assertions.assertEquals(2, counter.get());
	}

	@Test
	public void copyableSeedUsesItsOwnCopy() {
		CopyableApp seed = new CopyableApp(new AtomicInteger(3));
		InstanceFactory<CopyableApp> instanceFactory = InstanceFactory.copying(seed);

		CopyableApp copy = instanceFactory.create();

		Assertions.assertNotSame(seed, copy);
		Assertions.assertSame(seed.counter, copy.counter);
	}

	@Test
	public void failuresAreWrapped() {
		InstanceFactory<App> throwing = InstanceFactory.fresh(() -> {
			throw new IllegalStateException("no database");
		});

		InstanceCreationException e = Assertions.assertThrows(InstanceCreationException.class, throwing::create);
		Assertions.assertEquals("no database", e.getCause().getMessage());

		Assertions.assertThrows(InstanceCreationException.class, InstanceFactory.<App>fresh(() -> null)::create);
		Assertions.assertThrows(InstanceCreationException.class, InstanceFactory.copying(new App(new AtomicInteger()), app -> null)::create);
	}

	@NotThreadSafe
	private static class App {
		@Nonnull
		private final AtomicInteger counter;
		private int scratch;

		App(@Nonnull AtomicInteger counter) {
			this.counter = counter;
		}
	}

	@ThreadSafe
	private static class CopyableApp implements Copyable<CopyableApp> {
		@Nonnull
		private final AtomicInteger counter;

		CopyableApp(@Nonnull AtomicInteger counter) {
			this.counter = counter;
		}

		@Nonnull
		@Override
		public CopyableApp copy() {
			return new CopyableApp(this.counter);
		}
	}
}
