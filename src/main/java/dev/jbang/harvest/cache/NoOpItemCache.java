package dev.jbang.harvest.cache;

import dev.jbang.harvest.error.CacheException;
import java.util.Iterator;
import java.util.Map;

/** No-operation cache. Every write is ignored and there is nothing to retrieve. */
final class NoOpItemCache implements ItemCache {
	static final NoOpItemCache INSTANCE = new NoOpItemCache();

	private NoOpItemCache() {}

	@Override
	public void push(Map<String, Object> record) {}

	@Override
	public void flush(boolean force) {}

	@Override
	public void purgeQueue() {}

	@Override
	public void backup() {}

	@Override
	public void clean() {}

	@Override
	public void recover() {}

	@Override
	public Iterator<Map<String, Object>> retrieve() {
		throw new CacheException("cache instance was not provided");
	}

	@Override
	public boolean isEnabled() {
		return false;
	}

	@Override
	public String toString() {
		return "NoOpItemCache";
	}
}
