package io.taskstore.spi;

public interface DataStoreSession
        extends AutoCloseable
{
    @Override
    void close();
}
