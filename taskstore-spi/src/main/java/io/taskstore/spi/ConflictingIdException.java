package io.taskstore.spi;

public class ConflictingIdException
        extends Exception
{
    private final String id;

    public ConflictingIdException(String id)
    {
        super("This data store already contains a schedule with the identifier " + id);
        this.id = id;
    }

    public String getId()
    {
        return id;
    }
}
