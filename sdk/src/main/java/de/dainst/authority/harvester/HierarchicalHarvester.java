/*
 * Copyright © 2024 Deutsches Archäologisches Institut
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dainst.authority.harvester;

import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.fetch.BatchFetcher;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.fetch.RetryPolicy;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.record.AuthorityRecord;
import de.dainst.authority.harvester.record.MarcRecordEncoder;
import de.dainst.authority.harvester.record.RecordAssembler;
import de.dainst.authority.harvester.record.SourceProfile;
import de.dainst.authority.harvester.resolve.AncestorChain;
import de.dainst.authority.harvester.resolve.AncestorResolver;
import de.dainst.authority.harvester.resolve.CachingItemResolver;
import de.dainst.authority.harvester.resolve.ItemCache;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.marc4j.marc.Record;

/**
 * Harvester for sources whose items point to a parent item, producing one authority record per
 * item with see-also references to its ancestors.
 *
 * <p>Every run gets a fresh {@link ItemCache}, shared by batch fetching and ancestor resolution.
 */
public abstract class HierarchicalHarvester extends AbstractHarvester {
  private static final Logger logger = Logger.getLogger(HierarchicalHarvester.class.getName());

  private BatchFetcher<ResolvedItem> batchFetcher;
  private CachingItemResolver itemResolver;
  private AncestorResolver ancestorResolver;
  private RecordAssembler assembler;
  private MarcRecordEncoder encoder;

  protected HierarchicalHarvester(String name) {
    super(name);
  }

  /** Decoder of the source's detail documents. */
  protected abstract PayloadParser<ResolvedItem> getPayloadParser();

  /** Maps parent pointers to detail document URLs. */
  protected abstract ItemLocator getItemLocator();

  protected abstract SourceProfile getSourceProfile();

  /** Name of the single output of this harvester. */
  protected abstract String getOutputName();

  /** Whether parents and ancestors of a batch are fetched eagerly with the batch. */
  protected boolean isPrefetchAncestors() {
    return true;
  }

  /** Reads source specific configuration; called before the fetchers are created. */
  protected void configure(HarvestContext context) throws Exception {}

  @Override
  protected final void startUp(HarvestContext context) throws Exception {
    configure(context);
    RetryingFetcher<ResolvedItem> fetcher =
        new RetryingFetcher<>(
            context.getTransport(), getPayloadParser(), RetryPolicy.fromConfiguration());
    batchFetcher = BatchFetcher.fromConfiguration(fetcher, getName());
    itemResolver =
        new CachingItemResolver(batchFetcher, new ItemCache(), getItemLocator(),
            isPrefetchAncestors());
    ancestorResolver = new AncestorResolver(itemResolver);
    assembler = new RecordAssembler(getSourceProfile());
    encoder = new MarcRecordEncoder();
  }

  @Override
  protected List<String> getOutputNames() {
    return ImmutableList.of(getOutputName());
  }

  protected CachingItemResolver getItemResolver() {
    return itemResolver;
  }

  @Override
  protected int processBatch(List<ItemReference> batch) throws IOException {
    transition(HarvestState.FETCHING_BATCH);
    List<ResolvedItem> items = itemResolver.resolveAll(batch);
    if (items.size() < batch.size()) {
      logger.log(Level.WARNING, "{0} of {1} items could not be fetched",
          new Object[] {batch.size() - items.size(), batch.size()});
    }

    transition(HarvestState.RESOLVING);
    List<AncestorChain> chains = new ArrayList<>(items.size());
    for (ResolvedItem item : items) {
      chains.add(ancestorResolver.resolve(item));
    }

    transition(HarvestState.ASSEMBLING);
    List<Record> records = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      Optional<AuthorityRecord> record = assembler.assemble(items.get(i), chains.get(i));
      if (record.isPresent()) {
        records.add(encoder.encode(record.get()));
      }
    }

    transition(HarvestState.WRITING);
    for (Record record : records) {
      write(getOutputName(), record);
    }
    logger.log(Level.FINE, "Cache holds {0} items", itemResolver.getCache().size());
    return records.size();
  }

  @Override
  public void destroy() {
    if (batchFetcher != null) {
      batchFetcher.close();
      batchFetcher = null;
    }
  }
}
